package com.tempgame.model;

import static com.google.common.base.Preconditions.checkElementIndex;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * The edges usable at one instant, in compressed-row form. Sources are sorted ascending by vertex index, the
 * destinations of each source as well. Instances are immutable.
 */
public final class EdgeLayer {
  public static final EdgeLayer EMPTY = new EdgeLayer(new int[0], new int[] {0}, new int[0]);

  private final int[] sources;
  private final int[] offsets;
  private final int[] destinations;

  private EdgeLayer(int[] sources, int[] offsets, int[] destinations) {
    assert offsets.length == sources.length + 1;
    assert offsets[sources.length] == destinations.length;
    this.sources = sources;
    this.offsets = offsets;
    this.destinations = destinations;
  }

  static EdgeLayer of(Int2ObjectSortedMap<IntSortedSet> successors) {
    if (successors.isEmpty()) {
      return EMPTY;
    }
    int[] sources = new int[successors.size()];
    int[] offsets = new int[successors.size() + 1];
    int[] destinations = new int[successors.values().stream().mapToInt(IntSortedSet::size).sum()];
    int source = 0;
    int edge = 0;
    for (Int2ObjectMap.Entry<IntSortedSet> entry : successors.int2ObjectEntrySet()) {
      sources[source] = entry.getIntKey();
      offsets[source] = edge;
      IntIterator iterator = entry.getValue().iterator();
      while (iterator.hasNext()) {
        destinations[edge++] = iterator.nextInt();
      }
      source += 1;
    }
    offsets[source] = edge;
    return new EdgeLayer(sources, offsets, destinations);
  }

  public boolean isEmpty() {
    return sources.length == 0;
  }

  public int sourceCount() {
    return sources.length;
  }

  public int edgeCount() {
    return destinations.length;
  }

  /** Vertex index of the {@code position}-th source of this layer. */
  public int source(int position) {
    checkElementIndex(position, sources.length);
    return sources[position];
  }

  public int successorCount(int position) {
    checkElementIndex(position, sources.length);
    return offsets[position + 1] - offsets[position];
  }

  public int successor(int position, int successor) {
    checkElementIndex(successor, successorCount(position));
    return destinations[offsets[position] + successor];
  }

  public IntStream successors(int position) {
    checkElementIndex(position, sources.length);
    return Arrays.stream(destinations, offsets[position], offsets[position + 1]);
  }

  /** Position of the given vertex among the sources, or a negative value if it has no edge in this layer. */
  public int positionOf(int vertexIndex) {
    return Arrays.binarySearch(sources, vertexIndex);
  }

  public IntStream successorsOf(int vertexIndex) {
    int position = positionOf(vertexIndex);
    return position < 0 ? IntStream.empty() : successors(position);
  }
}
