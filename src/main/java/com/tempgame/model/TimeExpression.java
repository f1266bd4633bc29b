package com.tempgame.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Set;

/**
 * Integer term over time variables, as used in edge guards. Terms are evaluated with 64 bit arithmetic; the
 * remainder follows Java's {@code %}, i.e. it takes the sign of the dividend.
 */
public interface TimeExpression {
  /** Evaluates the term with every variable set to {@code value}. */
  long evaluate(long value);

  /** Adds the variables of this term that are not contained in {@code bound} to {@code free}. */
  void collectVariables(Set<String> bound, Set<String> free);

  record Constant(long value) implements TimeExpression {
    @Override
    public long evaluate(long ignored) {
      return value;
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      // no variables
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  record Variable(String name) implements TimeExpression {
    public Variable {
      requireNonNull(name);
    }

    @Override
    public long evaluate(long value) {
      return value;
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      if (!bound.contains(name)) {
        free.add(name);
      }
    }

    @Override
    public String toString() {
      return name;
    }
  }

  record Sum(TimeExpression left, TimeExpression right) implements TimeExpression {
    @Override
    public long evaluate(long value) {
      return Math.addExact(left.evaluate(value), right.evaluate(value));
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      left.collectVariables(bound, free);
      right.collectVariables(bound, free);
    }

    @Override
    public String toString() {
      return "(+ %s %s)".formatted(left, right);
    }
  }

  record Difference(TimeExpression left, TimeExpression right) implements TimeExpression {
    @Override
    public long evaluate(long value) {
      return Math.subtractExact(left.evaluate(value), right.evaluate(value));
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      left.collectVariables(bound, free);
      right.collectVariables(bound, free);
    }

    @Override
    public String toString() {
      return "(- %s %s)".formatted(left, right);
    }
  }

  /** Multiplication with a constant factor. */
  record Product(long factor, TimeExpression inner) implements TimeExpression {
    @Override
    public long evaluate(long value) {
      return Math.multiplyExact(factor, inner.evaluate(value));
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      inner.collectVariables(bound, free);
    }

    @Override
    public String toString() {
      return "(* %d %s)".formatted(factor, inner);
    }
  }

  /** Remainder by a non-zero constant modulus. */
  record Remainder(TimeExpression inner, long modulus) implements TimeExpression {
    public Remainder {
      checkArgument(modulus != 0, "Modulus must not be zero");
      checkArgument(modulus != Long.MIN_VALUE, "Modulus out of range");
    }

    @Override
    public long evaluate(long value) {
      return inner.evaluate(value) % modulus;
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      inner.collectVariables(bound, free);
    }

    @Override
    public String toString() {
      return "(mod %s %d)".formatted(inner, modulus);
    }
  }
}
