package com.tempgame.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.tempgame.model.EdgeLayer;
import com.tempgame.model.TargetSet;
import com.tempgame.model.TemporalGraph;
import com.tempgame.model.Vertex;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Witnessing moves of the reaching player, read off a complete table. For a winning vertex of the reaching player
 * the move is the usable edge into the next winning set with the lowest destination index. Vertices of the other
 * player need no move, and neither do target vertices under {@link TargetPolicy#BY_DEADLINE}, which have already won.
 */
public final class StrategyExtractor {
  private final TemporalGraph graph;
  private final WinningSetTable table;
  private final TargetSet target;
  private final SolverOptions options;

  private StrategyExtractor(TemporalGraph graph, WinningSetTable table, TargetSet target, SolverOptions options) {
    this.graph = graph;
    this.table = table;
    this.target = target;
    this.options = options;
  }

  public static StrategyExtractor of(TemporalGraph graph, WinningSetTable table, TargetSet target,
      SolverOptions options) {
    checkState(table.retention() == Retention.ALL, "Strategies need all rows of the table");
    checkState(table.isComplete(), "Table is incomplete");
    checkArgument(target.vertices().stream().allMatch(graph::contains), "Target does not belong to the graph");
    return new StrategyExtractor(graph, table, target, options);
  }

  public Optional<Vertex> move(Vertex vertex, int time) {
    checkArgument(graph.contains(vertex), "Unknown vertex %s", vertex);
    if (time < 0 || time > table.deadline()) {
      throw new IndexOutOfBoundsException("Time %d outside of [0, %d]".formatted(time, table.deadline()));
    }
    if (time == table.deadline()
        || vertex.owner() != options.reacher()
        || !table.at(time).contains(vertex)
        || (options.targetPolicy() == TargetPolicy.BY_DEADLINE && target.contains(vertex))) {
      return Optional.empty();
    }
    WinningSet next = table.at(time + 1);
    EdgeLayer layer = graph.layerAt(time);
    int position = layer.positionOf(vertex.index());
    assert position >= 0 : "Winning vertex without edges";
    for (int i = 0; i < layer.successorCount(position); i++) {
      int successor = layer.successor(position, i);
      if (next.contains(successor)) {
        return Optional.of(graph.vertex(successor));
      }
    }
    throw new AssertionError("No witness for winning vertex %s at time %d".formatted(vertex, time));
  }

  /** All moves at the given time, ordered by vertex index. */
  public Map<Vertex, Vertex> moves(int time) {
    Map<Vertex, Vertex> moves = new LinkedHashMap<>();
    table.at(time).vertices(graph).forEach(vertex -> move(vertex, time).ifPresent(m -> moves.put(vertex, m)));
    return Collections.unmodifiableMap(moves);
  }
}
