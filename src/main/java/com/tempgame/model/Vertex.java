package com.tempgame.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A vertex of a temporal graph. The index is the position of the vertex in declaration order and doubles as its
 * bit position in winning sets.
 */
public record Vertex(String name, int index, Player owner) implements Comparable<Vertex> {
  public Vertex {
    requireNonNull(name);
    requireNonNull(owner);
    checkArgument(index >= 0, "Negative index %s for vertex %s", index, name);
  }

  @Override
  public int compareTo(Vertex o) {
    return Integer.compare(index, o.index);
  }

  @Override
  public String toString() {
    return name;
  }
}
