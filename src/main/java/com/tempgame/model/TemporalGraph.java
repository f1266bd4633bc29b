package com.tempgame.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * An immutable temporal graph. Every edge is usable exactly at its annotated instant; if the graph declares a
 * period {@code P}, an edge annotated with {@code i} is usable at every time {@code t} with {@code t mod P == i}.
 * Guarded edges are usable at every time their {@link TimeConstraint} holds.
 *
 * <p>Edges are indexed on construction into one layer per position of the schedule, so looking up the edges of a
 * time step does not scan the edge list. Times from {@link #periodStart()} on map to the positions
 * {@code periodStart() + (t - periodStart()) mod schedulePeriod()}.
 */
public final class TemporalGraph {
  /** Upper bound on the tabulated schedule positions of a graph with guarded edges. */
  public static final int MAX_SCHEDULE_LENGTH = 1 << 20;

  private final List<Vertex> vertices;
  private final Map<String, Vertex> verticesByName;
  private final Set<TemporalEdge> edges;
  private final Set<GuardedEdge> guardedEdges;
  private final Int2ObjectMap<EdgeLayer> layers;
  private final int maxInstant;
  private final int period;
  private final int periodStart;
  private final int schedulePeriod;

  private TemporalGraph(List<Vertex> vertices, Set<TemporalEdge> edges, Set<GuardedEdge> guardedEdges, int period) {
    this.vertices = ImmutableList.copyOf(vertices);
    this.verticesByName = vertices.stream().collect(ImmutableMap.toImmutableMap(Vertex::name, v -> v));
    this.edges = edges.stream()
        .sorted(Comparator.comparingInt(TemporalEdge::instant)
            .thenComparing(TemporalEdge::source)
            .thenComparing(TemporalEdge::destination))
        .collect(ImmutableSet.toImmutableSet());
    this.guardedEdges = guardedEdges.stream()
        .sorted(Comparator.comparing(GuardedEdge::source)
            .thenComparing(GuardedEdge::destination)
            .thenComparing(edge -> edge.guard().toString()))
        .collect(ImmutableSet.toImmutableSet());
    this.period = period;
    this.maxInstant = this.edges.stream().mapToInt(TemporalEdge::instant).max().orElse(-1);

    long start = period == 0 ? maxInstant + 1L : 0L;
    long cycle = period == 0 ? 1L : period;
    try {
      for (GuardedEdge edge : this.guardedEdges) {
        start = Math.max(start, edge.guard().stableFrom());
        cycle = TimeConstraint.lcm(cycle, edge.guard().period());
      }
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Schedule of the guarded edges is too long", e);
    }
    long positions = start + cycle;
    checkArgument(this.guardedEdges.isEmpty() || positions <= MAX_SCHEDULE_LENGTH,
        "Schedule of the guarded edges has %s positions, at most %s are supported", positions, MAX_SCHEDULE_LENGTH);
    this.periodStart = (int) start;
    this.schedulePeriod = (int) cycle;

    Int2ObjectMap<Int2ObjectSortedMap<IntSortedSet>> successorsByPosition = new Int2ObjectOpenHashMap<>();
    for (TemporalEdge edge : this.edges) {
      if (period == 0) {
        addSuccessor(successorsByPosition, edge.instant(), edge.source(), edge.destination());
      } else {
        for (long position = edge.instant(); position < positions; position += period) {
          addSuccessor(successorsByPosition, (int) position, edge.source(), edge.destination());
        }
      }
    }
    if (!this.guardedEdges.isEmpty()) {
      for (int position = 0; position < positions; position++) {
        for (GuardedEdge edge : this.guardedEdges) {
          if (edge.guard().test(position)) {
            addSuccessor(successorsByPosition, position, edge.source(), edge.destination());
          }
        }
      }
    }
    Int2ObjectMap<EdgeLayer> layers = new Int2ObjectOpenHashMap<>(successorsByPosition.size());
    successorsByPosition.int2ObjectEntrySet()
        .forEach(entry -> layers.put(entry.getIntKey(), EdgeLayer.of(entry.getValue())));
    layers.defaultReturnValue(EdgeLayer.EMPTY);
    this.layers = layers;
  }

  private static void addSuccessor(Int2ObjectMap<Int2ObjectSortedMap<IntSortedSet>> successorsByPosition,
      int position, Vertex source, Vertex destination) {
    Int2ObjectSortedMap<IntSortedSet> layer = successorsByPosition.get(position);
    if (layer == null) {
      layer = new Int2ObjectRBTreeMap<>();
      successorsByPosition.put(position, layer);
    }
    IntSortedSet successors = layer.get(source.index());
    if (successors == null) {
      successors = new IntRBTreeSet();
      layer.put(source.index(), successors);
    }
    successors.add(destination.index());
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Vertex> vertices() {
    return vertices;
  }

  public int vertexCount() {
    return vertices.size();
  }

  /** The edges with a fixed instant. */
  public Set<TemporalEdge> edges() {
    return edges;
  }

  public Set<GuardedEdge> guardedEdges() {
    return guardedEdges;
  }

  public Vertex vertex(String name) {
    Vertex vertex = verticesByName.get(name);
    if (vertex == null) {
      throw new UnknownVertexException(name);
    }
    return vertex;
  }

  public Vertex vertex(int index) {
    return vertices.get(index);
  }

  public boolean contains(Vertex vertex) {
    return vertex.index() < vertices.size() && vertices.get(vertex.index()).equals(vertex);
  }

  public Player owner(String name) {
    return vertex(name).owner();
  }

  public Player owner(Vertex vertex) {
    if (!contains(vertex)) {
      throw new UnknownVertexException(vertex.name());
    }
    return vertex.owner();
  }

  /** The schedule period declared by the graph, if any. */
  public OptionalInt period() {
    return period == 0 ? OptionalInt.empty() : OptionalInt.of(period);
  }

  /** The largest annotated instant, or -1 for a graph without edges with a fixed instant. */
  public int maxInstant() {
    return maxInstant;
  }

  /** First time from which the edge schedule repeats with {@link #schedulePeriod()}. */
  public int periodStart() {
    return periodStart;
  }

  /**
   * Period of the edge schedule from {@link #periodStart()} on. An aperiodic graph without guarded edges has no
   * edges after its last instant, which repeats with period 1.
   */
  public int schedulePeriod() {
    return schedulePeriod;
  }

  /** Position in the schedule whose edges are usable at the given time. */
  public int positionOf(int time) {
    checkArgument(time >= 0, "Negative time %s", time);
    return time < periodStart ? time : periodStart + (time - periodStart) % schedulePeriod;
  }

  public EdgeLayer layerAt(int time) {
    return layers.get(positionOf(time));
  }

  /**
   * The edges usable at the given time. Each edge is annotated with the schedule position of the time, which is the
   * instant of the declaration for edges with a fixed instant.
   */
  public Set<TemporalEdge> edgesAt(int time) {
    int position = positionOf(time);
    EdgeLayer layer = layers.get(position);
    ImmutableSet.Builder<TemporalEdge> builder = ImmutableSet.builderWithExpectedSize(layer.edgeCount());
    for (int index = 0; index < layer.sourceCount(); index++) {
      Vertex source = vertices.get(layer.source(index));
      layer.successors(index)
          .forEach(destination -> builder.add(new TemporalEdge(source, vertices.get(destination), position)));
    }
    return builder.build();
  }

  public Set<Vertex> successorsAt(Vertex vertex, int time) {
    if (!contains(vertex)) {
      throw new UnknownVertexException(vertex.name());
    }
    return layerAt(time).successorsOf(vertex.index())
        .mapToObj(vertices::get)
        .collect(ImmutableSet.toImmutableSet());
  }

  @Override
  public String toString() {
    return "TemporalGraph[vertices=%d,edges=%d,guarded=%d,period=%s]".formatted(vertices.size(), edges.size(),
        guardedEdges.size(), period == 0 ? "none" : String.valueOf(period));
  }

  public static final class Builder {
    private final Map<String, Vertex> vertices = new LinkedHashMap<>();
    private final List<TemporalEdge> edges = new ArrayList<>();
    private final List<GuardedEdge> guardedEdges = new ArrayList<>();
    private int period = 0;

    private Builder() {}

    public Vertex addVertex(String name, Player owner) {
      checkArgument(!name.isEmpty(), "Empty vertex name");
      checkArgument(!vertices.containsKey(name), "Duplicate vertex %s", name);
      Vertex vertex = new Vertex(name, vertices.size(), owner);
      vertices.put(name, vertex);
      return vertex;
    }

    public Builder period(int period) {
      checkArgument(period >= 1, "Period must be positive, got %s", period);
      checkState(this.period == 0, "Period already set to %s", this.period);
      checkArgument(edges.stream().allMatch(edge -> edge.instant() < period),
          "Existing edges exceed period %s", period);
      this.period = period;
      return this;
    }

    public Builder addEdge(String source, String destination, int instant) {
      checkArgument(instant >= 0, "Negative instant %s", instant);
      checkArgument(period == 0 || instant < period, "Instant %s outside of period %s", instant, period);
      edges.add(new TemporalEdge(lookup(source), lookup(destination), instant));
      return this;
    }

    public Builder addEdge(String source, String destination, int... instants) {
      IntStream.of(instants).forEach(instant -> addEdge(source, destination, instant));
      return this;
    }

    public Builder addEdge(String source, String destination, TimeConstraint guard) {
      guardedEdges.add(new GuardedEdge(lookup(source), lookup(destination), guard));
      return this;
    }

    private Vertex lookup(String name) {
      Vertex vertex = vertices.get(name);
      if (vertex == null) {
        throw new UnknownVertexException(name, "Edge references undeclared vertex " + name);
      }
      return vertex;
    }

    public TemporalGraph build() {
      return new TemporalGraph(List.copyOf(vertices.values()), Set.copyOf(edges), Set.copyOf(guardedEdges), period);
    }
  }
}
