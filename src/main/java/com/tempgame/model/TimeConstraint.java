package com.tempgame.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.math.LongMath;
import java.util.Set;

/**
 * A compiled edge guard: a quantifier-free {@link TimeFormula} with at most one free variable, which stands for the
 * current time. An edge with this guard is usable at every time for which the formula holds.
 *
 * <p>Every such guard is ultimately periodic. {@link #stableFrom()} and {@link #period()} are computed from the
 * syntax tree so that {@code test(t) == test(t + period())} holds for all {@code t >= stableFrom()}. This lets the
 * graph tabulate guarded edges over a finite prefix of time.
 */
public final class TimeConstraint {
  public static final TimeConstraint ALWAYS = of(TimeFormula.TRUE);

  private final TimeFormula formula;
  private final int stableFrom;
  private final int period;

  private TimeConstraint(TimeFormula formula, int stableFrom, int period) {
    this.formula = formula;
    this.stableFrom = stableFrom;
    this.period = period;
  }

  /**
   * Compiles the given formula.
   *
   * @throws IllegalArgumentException if the formula has quantifiers, more than one free variable, or a schedule too
   *     large to represent
   */
  public static TimeConstraint of(TimeFormula formula) {
    requireNonNull(formula);
    checkArgument(formula.isQuantifierFree(), "Formula %s contains quantifiers", formula);
    Set<String> variables = formula.freeVariables();
    checkArgument(variables.size() <= 1, "Formula %s must have at most one free variable, has %s", formula,
        variables);
    Schedule schedule;
    try {
      schedule = schedule(formula);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Formula %s has a schedule too large to represent".formatted(formula), e);
    }
    checkArgument(schedule.from() <= Integer.MAX_VALUE && schedule.period() <= Integer.MAX_VALUE,
        "Formula %s has a schedule too large to represent", formula);
    return new TimeConstraint(formula, (int) schedule.from(), (int) schedule.period());
  }

  public TimeFormula formula() {
    return formula;
  }

  public boolean test(int time) {
    checkArgument(time >= 0, "Negative time %s", time);
    return formula.holds(time);
  }

  /** First time from which the truth value repeats with {@link #period()}. */
  public int stableFrom() {
    return stableFrom;
  }

  public int period() {
    return period;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TimeConstraint that && formula.equals(that.formula));
  }

  @Override
  public int hashCode() {
    return formula.hashCode();
  }

  @Override
  public String toString() {
    return formula.toString();
  }

  static long lcm(long a, long b) {
    return LongMath.checkedMultiply(a / LongMath.gcd(a, b), b);
  }

  private static Schedule schedule(TimeFormula formula) {
    if (formula instanceof TimeFormula.Literal) {
      return Schedule.CONSTANT;
    }
    if (formula instanceof TimeFormula.Negation negation) {
      return schedule(negation.operand());
    }
    if (formula instanceof TimeFormula.Conjunction conjunction) {
      return conjunction.operands().stream().map(TimeConstraint::schedule)
          .reduce(Schedule.CONSTANT, Schedule::combine);
    }
    if (formula instanceof TimeFormula.Disjunction disjunction) {
      return disjunction.operands().stream().map(TimeConstraint::schedule)
          .reduce(Schedule.CONSTANT, Schedule::combine);
    }
    if (formula instanceof TimeFormula.Comparison comparison) {
      Shape difference = Shape.subtract(shape(comparison.left()), shape(comparison.right()));
      if (difference.slope() == 0) {
        return new Schedule(difference.from(), difference.period());
      }
      // Once the linear part dominates, the sign of the difference and with it the comparison is fixed
      return new Schedule(difference.signFixedFrom(), 1);
    }
    throw new IllegalArgumentException("Unsupported formula " + formula);
  }

  private static Shape shape(TimeExpression expression) {
    if (expression instanceof TimeExpression.Constant constant) {
      return new Shape(0, constant.value(), 0, 1, 0);
    }
    if (expression instanceof TimeExpression.Variable) {
      return new Shape(1, 0, 0, 1, 0);
    }
    if (expression instanceof TimeExpression.Sum sum) {
      return Shape.add(shape(sum.left()), shape(sum.right()));
    }
    if (expression instanceof TimeExpression.Difference difference) {
      return Shape.subtract(shape(difference.left()), shape(difference.right()));
    }
    if (expression instanceof TimeExpression.Product product) {
      Shape inner = shape(product.inner());
      long factor = product.factor();
      return new Shape(LongMath.checkedMultiply(factor, inner.slope()),
          LongMath.checkedMultiply(factor, inner.offset()),
          LongMath.checkedMultiply(Math.absExact(factor), inner.bound()), inner.period(), inner.from());
    }
    if (expression instanceof TimeExpression.Remainder remainder) {
      Shape inner = shape(remainder.inner());
      long modulus = Math.abs(remainder.modulus());
      if (inner.slope() == 0) {
        return new Shape(0, 0, modulus - 1, inner.period(), inner.from());
      }
      // With a fixed sign, adding a multiple of the modulus does not change the remainder
      return new Shape(0, 0, modulus - 1, lcm(inner.period(), modulus), inner.signFixedFrom());
    }
    throw new IllegalArgumentException("Unsupported term " + expression);
  }

  /** Truth value repeats with {@code period} from {@code from} on. */
  private record Schedule(long from, long period) {
    static final Schedule CONSTANT = new Schedule(0, 1);

    Schedule combine(Schedule other) {
      return new Schedule(Math.max(from, other.from), lcm(period, other.period));
    }
  }

  /**
   * For all {@code t >= from}, the term equals {@code slope * t + offset + r(t)} where {@code r} repeats with
   * {@code period} and {@code |r(t)| <= bound}.
   */
  private record Shape(long slope, long offset, long bound, long period, long from) {
    static Shape add(Shape left, Shape right) {
      return new Shape(Math.addExact(left.slope, right.slope), Math.addExact(left.offset, right.offset),
          Math.addExact(left.bound, right.bound), lcm(left.period, right.period), Math.max(left.from, right.from));
    }

    static Shape subtract(Shape left, Shape right) {
      return new Shape(Math.subtractExact(left.slope, right.slope), Math.subtractExact(left.offset, right.offset),
          Math.addExact(left.bound, right.bound), lcm(left.period, right.period), Math.max(left.from, right.from));
    }

    /** First time from which the term is non-zero with the sign of the slope. Requires a non-zero slope. */
    long signFixedFrom() {
      assert slope != 0;
      long threshold = Math.addExact(Math.absExact(offset), bound) / Math.absExact(slope) + 1;
      return Math.max(from, threshold);
    }
  }
}
