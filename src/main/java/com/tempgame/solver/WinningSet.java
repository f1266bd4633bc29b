package com.tempgame.solver;

import com.tempgame.model.TemporalGraph;
import com.tempgame.model.Vertex;
import java.util.BitSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Immutable snapshot of the vertices from which the reaching player wins at one time step, stored as a bit set over
 * vertex indices.
 */
public final class WinningSet {
  private static final WinningSet EMPTY = new WinningSet(new BitSet());

  private final BitSet bits;
  private final int hashCode;

  private WinningSet(BitSet bits) {
    this.bits = bits;
    this.hashCode = bits.hashCode();
  }

  public static WinningSet empty() {
    return EMPTY;
  }

  /** Takes ownership of the given bits; the caller must not modify them afterwards. */
  static WinningSet wrap(BitSet bits) {
    return bits.isEmpty() ? EMPTY : new WinningSet(bits);
  }

  public static WinningSet copyOf(BitSet bits) {
    return wrap((BitSet) bits.clone());
  }

  public boolean contains(int index) {
    return bits.get(index);
  }

  public boolean contains(Vertex vertex) {
    return bits.get(vertex.index());
  }

  public int size() {
    return bits.cardinality();
  }

  public boolean isEmpty() {
    return bits.isEmpty();
  }

  public IntStream indices() {
    return bits.stream();
  }

  public List<Vertex> vertices(TemporalGraph graph) {
    return bits.stream().mapToObj(graph::vertex).toList();
  }

  public BitSet toBitSet() {
    return (BitSet) bits.clone();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof WinningSet that && hashCode == that.hashCode && bits.equals(that.bits));
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return bits.stream().mapToObj(String::valueOf).collect(Collectors.joining(",", "{", "}"));
  }
}
