package com.tempgame.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import com.tempgame.model.EdgeLayer;
import com.tempgame.model.Player;
import com.tempgame.model.TargetSet;
import com.tempgame.model.TemporalGraph;
import com.tempgame.model.UnknownVertexException;
import com.tempgame.model.Vertex;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Solves punctual reachability games on a temporal graph by backward induction over time.
 *
 * <p>Starting from the target set at the deadline, the winning set at time {@code t} is derived from the one at
 * {@code t + 1} and the edges usable at {@code t}: a vertex of the reaching player wins if some usable edge leads into
 * the next winning set, a vertex of the other player wins if all usable edges do. Vertices without usable edges keep
 * a fixed status (losing for the reaching player, winning for the other), so each step only touches the sources of
 * the current edge layer.
 *
 * <p>If enabled, repetitions of the winning set sequence in the periodic part of the schedule are detected and the
 * remaining rows are replayed instead of computed.
 */
public final class BackwardInductionSolver implements AutoCloseable {
  private static final Logger log = Logger.getLogger(BackwardInductionSolver.class.getName());
  private static final int MIN_PARALLEL_SOURCES = 512;

  private final TemporalGraph graph;
  private final SolverOptions options;
  private final BitSet existential;
  private final BitSet universal;
  @Nullable
  private final ExecutorService executor;

  public BackwardInductionSolver(TemporalGraph graph) {
    this(graph, SolverOptions.defaults());
  }

  public BackwardInductionSolver(TemporalGraph graph, SolverOptions options) {
    this.graph = requireNonNull(graph);
    this.options = requireNonNull(options);
    this.existential = new BitSet(graph.vertexCount());
    this.universal = new BitSet(graph.vertexCount());
    Player reacher = options.reacher();
    for (Vertex vertex : graph.vertices()) {
      (vertex.owner() == reacher ? existential : universal).set(vertex.index());
    }
    this.executor = options.parallelism() > 1
        ? Executors.newFixedThreadPool(options.parallelism(), new ThreadFactoryBuilder()
        .setThreadFactory(Executors.defaultThreadFactory())
        .setNameFormat("step-worker-%d")
        .setDaemon(true).build())
        : null;
  }

  public TemporalGraph graph() {
    return graph;
  }

  public SolverOptions options() {
    return options;
  }

  public WinningSetTable solve(Collection<String> targetNames, int deadline) {
    return solve(TargetSet.of(graph, targetNames), deadline);
  }

  public WinningSetTable solve(TargetSet target, int deadline) {
    checkArgument(deadline >= 0, "Negative deadline %s", deadline);
    Objective objective = objective(target);
    log.log(Level.FINE, () -> "Solving %s for %s with target %s and deadline %d"
        .formatted(graph, options.reacher(), target, deadline));
    Stopwatch timer = Stopwatch.createStarted();

    WinningSetTable table = new WinningSetTable(deadline, options.retention());
    WinningSet next = WinningSet.copyOf(target.toBitSet());
    table.record(deadline, next);

    @Nullable
    CycleDetector detector = options.detectPeriodicity() && options.maxTrackedStates() > 0
        ? new CycleDetector(graph.schedulePeriod(), options.maxTrackedStates())
        : null;
    int periodStart = graph.periodStart();

    int time = deadline - 1;
    while (time >= 0) {
      if (detector != null && time >= periodStart) {
        Optional<CycleDetector.Cycle> cycle = detector.observe(time, next);
        if (cycle.isPresent()) {
          CycleDetector.Cycle detected = cycle.get();
          int detectedAt = time;
          log.log(Level.FINE, () -> "Detected cycle of length %d at time %d, replaying down to %d"
              .formatted(detected.length(), detectedAt, periodStart));
          table.replay(time, periodStart, detected::at);
          next = detected.at(periodStart);
          time = periodStart - 1;
          detector = null;
          continue;
        }
        if (detector.isExhausted()) {
          log.log(Level.FINE, "Tracked state limit reached, no cycle detected");
          detector = null;
        }
      }
      next = step(time, next, objective);
      table.record(time, next);
      time -= 1;
    }
    assert table.isComplete();
    log.log(Level.INFO, () -> "Solved deadline %d in %s (%d of %d steps replayed), %d winning at time 0"
        .formatted(deadline, timer, table.skippedSteps(), deadline, table.initial().size()));
    return table;
  }

  /** Computes the winning set at time {@code time} from the winning set at {@code time + 1}. */
  public WinningSet step(int time, WinningSet next, TargetSet target) {
    return step(time, requireNonNull(next), objective(target));
  }

  private Objective objective(TargetSet target) {
    for (Vertex vertex : target.vertices()) {
      if (!graph.contains(vertex)) {
        throw new UnknownVertexException(vertex.name(), "Target vertex %s is not part of the graph".formatted(vertex));
      }
    }
    BitSet fixed = options.targetPolicy() == TargetPolicy.BY_DEADLINE ? target.toBitSet() : new BitSet();
    BitSet baseline = (BitSet) universal.clone();
    baseline.or(fixed);
    return new Objective(fixed, baseline);
  }

  private WinningSet step(int time, WinningSet next, Objective objective) {
    EdgeLayer layer = graph.layerAt(time);
    BitSet bits = (BitSet) objective.baseline().clone();
    int sources = layer.sourceCount();
    if (executor == null || sources < MIN_PARALLEL_SOURCES) {
      for (int position = 0; position < sources; position++) {
        int vertex = layer.source(position);
        if (!objective.fixed().get(vertex)) {
          bits.set(vertex, isWinning(layer, position, vertex, next));
        }
      }
    } else {
      boolean[] winning = evaluateParallel(layer, next);
      for (int position = 0; position < sources; position++) {
        int vertex = layer.source(position);
        if (!objective.fixed().get(vertex)) {
          bits.set(vertex, winning[position]);
        }
      }
    }
    return WinningSet.wrap(bits);
  }

  private boolean isWinning(EdgeLayer layer, int position, int vertex, WinningSet next) {
    int successors = layer.successorCount(position);
    assert successors > 0;
    if (existential.get(vertex)) {
      for (int i = 0; i < successors; i++) {
        if (next.contains(layer.successor(position, i))) {
          return true;
        }
      }
      return false;
    }
    for (int i = 0; i < successors; i++) {
      if (!next.contains(layer.successor(position, i))) {
        return false;
      }
    }
    return true;
  }

  private boolean[] evaluateParallel(EdgeLayer layer, WinningSet next) {
    assert executor != null;
    int sources = layer.sourceCount();
    boolean[] winning = new boolean[sources];
    int chunk = (sources + options.parallelism() - 1) / options.parallelism();
    List<Future<?>> futures = new ArrayList<>(options.parallelism());
    for (int start = 0; start < sources; start += chunk) {
      int from = start;
      int to = Math.min(sources, start + chunk);
      // Each task only writes its own range of the result array
      futures.add(executor.submit(() -> {
        for (int position = from; position < to; position++) {
          winning[position] = isWinning(layer, position, layer.source(position), next);
        }
      }));
    }
    for (Future<?> future : futures) {
      try {
        Uninterruptibles.getUninterruptibly(future);
      } catch (ExecutionException e) {
        Throwables.throwIfUnchecked(e.getCause());
        throw new IllegalStateException("Step evaluation failed", e.getCause());
      }
    }
    return winning;
  }

  @Override
  public void close() {
    if (executor != null) {
      executor.shutdown();
    }
  }

  private record Objective(BitSet fixed, BitSet baseline) {}
}
