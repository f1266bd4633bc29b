package com.tempgame.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.tempgame.model.GraphFixture;
import com.tempgame.model.Player;
import com.tempgame.model.TargetSet;
import com.tempgame.model.TemporalGraph;
import com.tempgame.model.Vertex;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Compares the solver against a direct evaluation of the game tree on small random graphs. */
public class GameTreeCrossCheckTest {

  private record Position(Vertex vertex, int time) {}

  private static final class GameTree {
    private final TemporalGraph graph;
    private final TargetSet target;
    private final int deadline;
    private final SolverOptions options;
    private final Map<Position, Boolean> memo = new HashMap<>();

    GameTree(TemporalGraph graph, TargetSet target, int deadline, SolverOptions options) {
      this.graph = graph;
      this.target = target;
      this.deadline = deadline;
      this.options = options;
    }

    boolean wins(Vertex vertex, int time) {
      Position position = new Position(vertex, time);
      Boolean known = memo.get(position);
      if (known != null) {
        return known;
      }
      boolean result;
      if (target.contains(vertex) && (time == deadline || options.targetPolicy() == TargetPolicy.BY_DEADLINE)) {
        result = true;
      } else if (time == deadline) {
        result = false;
      } else {
        Set<Vertex> successors = graph.successorsAt(vertex, time);
        if (vertex.owner() == options.reacher()) {
          result = successors.stream().anyMatch(s -> wins(s, time + 1));
        } else {
          result = successors.stream().allMatch(s -> wins(s, time + 1));
        }
      }
      memo.put(position, result);
      return result;
    }
  }

  @Test
  void randomGraphs() {
    Random random = new Random(20240601L);
    for (int i = 0; i < 60; i++) {
      int period = random.nextBoolean() ? 1 + random.nextInt(4) : 0;
      TemporalGraph graph = GraphFixture.randomGraph(random, 7, 18, period, 9);
      TargetSet target = TargetSet.of(graph, List.of("v" + random.nextInt(7), "v" + random.nextInt(7)));
      SolverOptions options = SolverOptions.defaults()
          .withReacher(random.nextBoolean() ? Player.CONTROLLER : Player.OPPONENT)
          .withTargetPolicy(random.nextBoolean() ? TargetPolicy.BY_DEADLINE : TargetPolicy.AT_DEADLINE);
      int deadline = random.nextInt(25);

      WinningSetTable table = new BackwardInductionSolver(graph, options).solve(target, deadline);
      GameTree tree = new GameTree(graph, target, deadline, options);
      for (int time = 0; time <= deadline; time++) {
        for (Vertex vertex : graph.vertices()) {
          assertEquals(tree.wins(vertex, time), table.at(time).contains(vertex),
              "graph %d, vertex %s, time %d".formatted(i, vertex, time));
        }
      }
    }
  }
}
