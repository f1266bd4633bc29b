package com.tempgame.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.tempgame.model.Player;

/**
 * Configuration of a {@link BackwardInductionSolver}.
 *
 * @param reacher the player trying to visit the target
 * @param targetPolicy whether visiting the target before the deadline counts
 * @param retention which rows of the table are kept
 * @param detectPeriodicity whether repetitions of the winning sets are replayed instead of computed
 * @param parallelism number of threads evaluating a single step
 * @param maxTrackedStates number of winning sets remembered while looking for a repetition. These snapshots are
 *     held in addition to the retained rows, so with {@link Retention#LAST} the memory of a run is bounded by this
 *     limit rather than by the deadline.
 */
public record SolverOptions(
    Player reacher,
    TargetPolicy targetPolicy,
    Retention retention,
    boolean detectPeriodicity,
    int parallelism,
    int maxTrackedStates) {
  public static final int DEFAULT_MAX_TRACKED_STATES = 1 << 16;

  public SolverOptions {
    requireNonNull(reacher);
    requireNonNull(targetPolicy);
    requireNonNull(retention);
    checkArgument(parallelism >= 1, "Parallelism must be positive, got %s", parallelism);
    checkArgument(maxTrackedStates >= 0, "Negative state limit %s", maxTrackedStates);
  }

  public static SolverOptions defaults() {
    return new SolverOptions(Player.CONTROLLER, TargetPolicy.BY_DEADLINE, Retention.ALL, true, 1,
        DEFAULT_MAX_TRACKED_STATES);
  }

  public SolverOptions withReacher(Player reacher) {
    return new SolverOptions(reacher, targetPolicy, retention, detectPeriodicity, parallelism, maxTrackedStates);
  }

  public SolverOptions withTargetPolicy(TargetPolicy targetPolicy) {
    return new SolverOptions(reacher, targetPolicy, retention, detectPeriodicity, parallelism, maxTrackedStates);
  }

  public SolverOptions withRetention(Retention retention) {
    return new SolverOptions(reacher, targetPolicy, retention, detectPeriodicity, parallelism, maxTrackedStates);
  }

  public SolverOptions withPeriodicityDetection(boolean detectPeriodicity) {
    return new SolverOptions(reacher, targetPolicy, retention, detectPeriodicity, parallelism, maxTrackedStates);
  }

  public SolverOptions withParallelism(int parallelism) {
    return new SolverOptions(reacher, targetPolicy, retention, detectPeriodicity, parallelism, maxTrackedStates);
  }

  public SolverOptions withMaxTrackedStates(int maxTrackedStates) {
    return new SolverOptions(reacher, targetPolicy, retention, detectPeriodicity, parallelism, maxTrackedStates);
  }
}
