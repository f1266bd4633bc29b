package com.tempgame.model;

import static java.util.Objects.requireNonNull;

/** An edge that is usable at every time its guard holds. */
public record GuardedEdge(Vertex source, Vertex destination, TimeConstraint guard) {
  public GuardedEdge {
    requireNonNull(source);
    requireNonNull(destination);
    requireNonNull(guard);
  }

  @Override
  public String toString() {
    return "%s->%s@%s".formatted(source.name(), destination.name(), guard);
  }
}
