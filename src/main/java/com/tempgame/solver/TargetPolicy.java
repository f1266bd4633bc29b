package com.tempgame.solver;

/** When a visit to the target counts. */
public enum TargetPolicy {
  /** The target may be visited at any time up to and including the deadline. */
  BY_DEADLINE,
  /** The target has to be occupied exactly at the deadline. */
  AT_DEADLINE
}
