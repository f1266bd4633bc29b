package com.tempgame.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds repetitions in the backward sequence of winning sets. Once the edge schedule is periodic, the winning set at
 * time {@code t} only depends on the winning set at {@code t + 1} and on {@code t} modulo the schedule period, so
 * the first repeated pair of those fixes the sequence for all earlier times of the periodic part.
 *
 * <p>Every observed winning set is kept until a cycle is found or the limit is exceeded, so the detector holds at
 * most {@code limit + 1} snapshots regardless of the table's {@link Retention}.
 */
final class CycleDetector {
  private record State(WinningSet next, int phase) {}

  private final int period;
  private final int limit;
  private final Object2IntMap<State> seen = new Object2IntOpenHashMap<>();
  private final List<WinningSet> history = new ArrayList<>();
  private int firstTime = -1;
  private boolean exhausted = false;

  CycleDetector(int period, int limit) {
    checkArgument(period >= 1, "Period must be positive, got %s", period);
    this.period = period;
    this.limit = limit;
    seen.defaultReturnValue(-1);
  }

  boolean isExhausted() {
    return exhausted;
  }

  /** Number of winning sets currently held for replay. */
  int trackedStates() {
    return history.size();
  }

  /**
   * Observes the winning set at {@code time + 1} before the set at {@code time} is computed. Times have to be
   * observed consecutively in decreasing order.
   */
  Optional<Cycle> observe(int time, WinningSet next) {
    checkState(!exhausted);
    if (firstTime == -1) {
      firstTime = time;
    }
    assert time == firstTime - history.size();
    history.add(next);

    int previousTime = seen.putIfAbsent(new State(next, time % period), time);
    if (previousTime != -1) {
      int length = previousTime - time;
      assert length % period == 0;
      ImmutableList.Builder<WinningSet> rows = ImmutableList.builderWithExpectedSize(length);
      for (int offset = 0; offset < length; offset++) {
        // W_(time + 1 + offset) was observed at time + offset
        rows.add(history.get(firstTime - time - offset));
      }
      return Optional.of(new Cycle(time, length, rows.build()));
    }
    if (seen.size() > limit) {
      exhausted = true;
      seen.clear();
      history.clear();
    }
    return Optional.empty();
  }

  /**
   * A cycle detected at {@code time}: for every time {@code s <= time} inside the periodic part of the schedule,
   * the winning set at {@code s} equals the one at {@code s + length}.
   */
  record Cycle(int time, int length, List<WinningSet> rows) {
    Cycle {
      checkArgument(rows.size() == length);
    }

    WinningSet at(int t) {
      checkArgument(t <= time, "Time %s after detection at %s", t, time);
      return rows.get(Math.floorMod(t - time - 1, length));
    }
  }
}
