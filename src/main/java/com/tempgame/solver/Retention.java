package com.tempgame.solver;

public enum Retention {
  /** Keep every row of the table, needed for strategy extraction. */
  ALL,
  /** Keep only the two most recently computed rows. */
  LAST
}
