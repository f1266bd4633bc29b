package com.tempgame.model;

import static com.google.common.base.Preconditions.checkArgument;

public record TemporalEdge(Vertex source, Vertex destination, int instant) {
  public TemporalEdge {
    checkArgument(instant >= 0, "Negative instant %s on edge %s -> %s", instant, source, destination);
  }

  @Override
  public String toString() {
    return "%s->%s@%d".formatted(source.name(), destination.name(), instant);
  }
}
