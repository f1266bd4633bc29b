package com.tempgame.model;

import com.google.common.collect.ImmutableSortedSet;
import java.util.BitSet;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/** A fixed set of vertices of one temporal graph that the reaching player wants to visit. */
public final class TargetSet {
  private final Set<Vertex> vertices;
  private final BitSet bits;

  private TargetSet(Set<Vertex> vertices) {
    this.vertices = ImmutableSortedSet.copyOf(vertices);
    this.bits = new BitSet();
    vertices.forEach(v -> bits.set(v.index()));
  }

  /** Resolves the given names against the graph, failing on the first unknown one. */
  public static TargetSet of(TemporalGraph graph, Collection<String> names) {
    return new TargetSet(names.stream().map(graph::vertex).collect(Collectors.toSet()));
  }

  public static TargetSet ofVertices(TemporalGraph graph, Collection<Vertex> vertices) {
    for (Vertex vertex : vertices) {
      if (!graph.contains(vertex)) {
        throw new UnknownVertexException(vertex.name(), "Target vertex %s is not part of the graph".formatted(vertex));
      }
    }
    return new TargetSet(Set.copyOf(vertices));
  }

  public Set<Vertex> vertices() {
    return vertices;
  }

  public boolean contains(Vertex vertex) {
    return vertices.contains(vertex);
  }

  public int size() {
    return vertices.size();
  }

  public boolean isEmpty() {
    return vertices.isEmpty();
  }

  /** A fresh copy of the membership bits, indexed by vertex index. */
  public BitSet toBitSet() {
    return (BitSet) bits.clone();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TargetSet that && vertices.equals(that.vertices));
  }

  @Override
  public int hashCode() {
    return vertices.hashCode();
  }

  @Override
  public String toString() {
    return vertices.stream().map(Vertex::name).collect(Collectors.joining(",", "{", "}"));
  }
}
