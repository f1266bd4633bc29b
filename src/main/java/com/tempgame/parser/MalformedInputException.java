package com.tempgame.parser;

public class MalformedInputException extends RuntimeException {
  private final int line;

  public MalformedInputException(String message) {
    this(0, message, null);
  }

  public MalformedInputException(String message, Throwable cause) {
    this(0, message, cause);
  }

  public MalformedInputException(int line, String message) {
    this(line, message, null);
  }

  public MalformedInputException(int line, String message, Throwable cause) {
    super(line > 0 ? "Line %d: %s".formatted(line, message) : message, cause);
    this.line = line;
  }

  /** The 1-based line of the offending input, or 0 if the input is not line based. */
  public int line() {
    return line;
  }
}
