package com.tempgame.model;

public class UnknownVertexException extends RuntimeException {
  private final String vertexName;

  public UnknownVertexException(String vertexName) {
    this(vertexName, "Unknown vertex " + vertexName);
  }

  public UnknownVertexException(String vertexName, String message) {
    super(message);
    this.vertexName = vertexName;
  }

  public String vertexName() {
    return vertexName;
  }
}
