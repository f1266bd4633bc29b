package com.tempgame.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;
import javax.annotation.Nullable;

/**
 * Winning sets per time step, recorded from the deadline down to time 0. Each row is recorded exactly once and never
 * revised. Depending on the {@link Retention}, either all rows or only the two most recent ones are kept.
 */
public final class WinningSetTable {
  /** Largest deadline for which {@link Retention#ALL} can hold every row in one array. */
  public static final int MAX_RETAINED_DEADLINE = Integer.MAX_VALUE - 9;

  private final int deadline;
  private final Retention retention;
  @Nullable
  private final WinningSet[] rows;
  @Nullable
  private WinningSet latest = null;
  @Nullable
  private WinningSet previous = null;
  private int nextTime;
  private int skippedSteps = 0;

  WinningSetTable(int deadline, Retention retention) {
    checkArgument(deadline >= 0, "Negative deadline %s", deadline);
    checkArgument(retention != Retention.ALL || deadline <= MAX_RETAINED_DEADLINE,
        "Deadline %s too large to retain all rows", deadline);
    this.deadline = deadline;
    this.retention = requireNonNull(retention);
    this.rows = retention == Retention.ALL ? new WinningSet[deadline + 1] : null;
    this.nextTime = deadline;
  }

  void record(int time, WinningSet winningSet) {
    checkState(time == nextTime, "Expected row for time %s, got %s", nextTime, time);
    requireNonNull(winningSet);
    if (rows != null) {
      rows[time] = winningSet;
    }
    previous = latest;
    latest = winningSet;
    nextTime -= 1;
  }

  /**
   * Records the rows from {@code from} down to {@code to} (both inclusive) without computing them. Only rows that
   * are retained are requested from the given function.
   */
  void replay(int from, int to, IntFunction<WinningSet> row) {
    checkArgument(to <= from, "Empty range [%s, %s]", to, from);
    checkState(from == nextTime, "Expected row for time %s, got %s", nextTime, from);
    if (rows == null) {
      if (from > to) {
        record(from, row.apply(to + 1));
        nextTime = to;
      }
      record(to, row.apply(to));
    } else {
      for (int time = from; time >= to; time--) {
        record(time, row.apply(time));
      }
    }
    skippedSteps += from - to + 1;
  }

  public int deadline() {
    return deadline;
  }

  public Retention retention() {
    return retention;
  }

  public boolean isComplete() {
    return nextTime < 0;
  }

  /** Number of rows that were filled in by replaying a detected cycle instead of being computed. */
  public int skippedSteps() {
    return skippedSteps;
  }

  private void checkTime(int time) {
    if (time < 0 || time > deadline) {
      throw new IndexOutOfBoundsException("Time %d outside of [0, %d]".formatted(time, deadline));
    }
  }

  public boolean isRetained(int time) {
    checkTime(time);
    if (time <= nextTime) {
      return false;
    }
    return rows != null || time - nextTime <= 2;
  }

  public WinningSet at(int time) {
    checkTime(time);
    checkState(isRetained(time), "Row for time %s is not available", time);
    if (rows != null) {
      return rows[time];
    }
    return time == nextTime + 1 ? requireNonNull(latest) : requireNonNull(previous);
  }

  /** The winning set at time 0. */
  public WinningSet initial() {
    checkState(isComplete(), "Table is incomplete, next row %s", nextTime);
    return at(0);
  }

  /** All retained rows, ordered by time, starting at the earliest. */
  public List<Row> rows() {
    if (nextTime == deadline) {
      return List.of();
    }
    List<Row> list = new ArrayList<>();
    int time = nextTime + 1;
    while (time <= deadline && isRetained(time)) {
      list.add(new Row(time, at(time)));
      if (time == deadline) {
        break;
      }
      time += 1;
    }
    return Collections.unmodifiableList(list);
  }

  public record Row(int time, WinningSet winningSet) {}
}
