package com.tempgame.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tempgame.model.GraphFixture;
import com.tempgame.model.Player;
import com.tempgame.model.TargetSet;
import com.tempgame.model.TemporalGraph;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

/** The cycle replay must give the same rows as computing every step. */
public class PeriodicityShortcutTest {
  private static final int[] DEADLINES = IntStream.concat(IntStream.rangeClosed(0, 40),
      IntStream.of(97, 256, 1_000, 4_099)).toArray();

  private static void assertSameRows(TemporalGraph graph, TargetSet target, SolverOptions options) {
    BackwardInductionSolver full = new BackwardInductionSolver(graph, options.withPeriodicityDetection(false));
    BackwardInductionSolver shortcut = new BackwardInductionSolver(graph, options.withPeriodicityDetection(true));
    for (int deadline : DEADLINES) {
      WinningSetTable expected = full.solve(target, deadline);
      WinningSetTable actual = shortcut.solve(target, deadline);
      assertEquals(0, expected.skippedSteps());
      if (options.retention() == Retention.ALL) {
        for (int time = 0; time <= deadline; time++) {
          assertEquals(expected.at(time), actual.at(time), "deadline %d, time %d".formatted(deadline, time));
        }
      } else {
        assertEquals(expected.rows(), actual.rows(), "deadline " + deadline);
      }
    }
  }

  @Test
  void periodicGraph() {
    TemporalGraph graph = GraphFixture.periodicGraph();
    for (TargetPolicy policy : TargetPolicy.values()) {
      for (Retention retention : Retention.values()) {
        SolverOptions options = SolverOptions.defaults().withTargetPolicy(policy).withRetention(retention);
        assertSameRows(graph, TargetSet.of(graph, List.of("goal")), options);
        assertSameRows(graph, TargetSet.of(graph, List.of("left", "right")), options);
      }
    }
  }

  @Test
  void aperiodicTail() {
    TemporalGraph graph = GraphFixture.scheduleGraph();
    for (TargetPolicy policy : TargetPolicy.values()) {
      for (Retention retention : Retention.values()) {
        SolverOptions options = SolverOptions.defaults().withTargetPolicy(policy).withRetention(retention);
        assertSameRows(graph, TargetSet.of(graph, List.of("z")), options);
      }
    }
  }

  @Test
  void randomPeriodicGraphs() {
    Random random = new Random(7);
    for (int i = 0; i < 20; i++) {
      TemporalGraph graph = GraphFixture.randomGraph(random, 6, 14, 1 + random.nextInt(5), 0);
      TargetSet target = TargetSet.of(graph, List.of("v" + random.nextInt(6)));
      Player reacher = random.nextBoolean() ? Player.CONTROLLER : Player.OPPONENT;
      assertSameRows(graph, target, SolverOptions.defaults().withReacher(reacher));
    }
  }

  @Test
  void shortcutSkipsSteps() {
    TemporalGraph graph = GraphFixture.scheduleGraph();
    WinningSetTable table = new BackwardInductionSolver(graph).solve(List.of("z"), 1_000);

    // Everything after the last instant is a single repeated step
    assertTrue(table.skippedSteps() >= 990, "skipped " + table.skippedSteps());
  }

  @Test
  void stateLimitFallsBackToStepping() {
    TemporalGraph graph = GraphFixture.periodicGraph();
    TargetSet target = TargetSet.of(graph, List.of("goal"));
    WinningSetTable expected = new BackwardInductionSolver(graph,
        SolverOptions.defaults().withPeriodicityDetection(false)).solve(target, 300);

    WinningSetTable disabled = new BackwardInductionSolver(graph,
        SolverOptions.defaults().withMaxTrackedStates(0)).solve(target, 300);
    assertEquals(0, disabled.skippedSteps());
    assertEquals(expected.rows(), disabled.rows());

    WinningSetTable limited = new BackwardInductionSolver(graph,
        SolverOptions.defaults().withMaxTrackedStates(1)).solve(target, 300);
    assertEquals(expected.rows(), limited.rows());
  }

  @Test
  void largestDeadlineWithLastRetention() {
    TemporalGraph graph = GraphFixture.periodicGraph();
    TargetSet target = TargetSet.of(graph, List.of("goal"));
    WinningSetTable table = new BackwardInductionSolver(graph, SolverOptions.defaults().withRetention(Retention.LAST))
        .solve(target, Integer.MAX_VALUE);

    assertTrue(table.isComplete());
    assertEquals(Integer.MAX_VALUE, table.deadline());
    assertTrue(table.isRetained(0));
    assertTrue(table.isRetained(1));
    assertFalse(table.isRetained(2));
    assertFalse(table.isRetained(Integer.MAX_VALUE));
    assertEquals(List.of(0, 1), table.rows().stream().map(WinningSetTable.Row::time).toList());

    // Visiting by the deadline only gets easier with more time, so the answer settles long before; both deadlines
    // leave the same remainder modulo the period of three
    WinningSetTable reference = new BackwardInductionSolver(graph,
        SolverOptions.defaults().withPeriodicityDetection(false)).solve(target, 301);
    assertEquals(Integer.MAX_VALUE % 3, 301 % 3);
    assertEquals(reference.initial(), table.initial());
  }

  @Test
  void guardedEdgesAgreeWithStepping() {
    TemporalGraph graph = GraphFixture.guardedGraph();
    for (TargetPolicy policy : TargetPolicy.values()) {
      for (Retention retention : Retention.values()) {
        SolverOptions options = SolverOptions.defaults().withTargetPolicy(policy).withRetention(retention);
        assertSameRows(graph, TargetSet.of(graph, List.of("s1")), options);
        assertSameRows(graph, TargetSet.of(graph, List.of("s2")), options.withReacher(Player.OPPONENT));
      }
    }
  }
}
