package com.tempgame.model;

import java.util.Locale;

public enum Player {
  CONTROLLER, OPPONENT;

  public int id() {
    return switch (this) {
      case CONTROLLER -> 0;
      case OPPONENT -> 1;
    };
  }

  public Player opponent() {
    return switch (this) {
      case CONTROLLER -> OPPONENT;
      case OPPONENT -> CONTROLLER;
    };
  }

  public static Player parse(String string) {
    return switch (string.toLowerCase(Locale.ROOT)) {
      case "0", "controller" -> CONTROLLER;
      case "1", "opponent" -> OPPONENT;
      default -> throw new IllegalArgumentException("Unsupported owner string " + string);
    };
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
