package com.tempgame.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Syntax tree of an edge guard: a first-order formula over integer time variables. Guards written in the
 * s-expression syntax {@code (and (>= x 5) (= (mod x 2) 0))} are turned into formulas by the parser and into
 * {@link TimeConstraint}s by the graph builder.
 */
public interface TimeFormula {
  TimeFormula TRUE = new Literal(true);
  TimeFormula FALSE = new Literal(false);

  /**
   * Evaluates a quantifier-free formula with every variable set to {@code value}.
   *
   * @throws IllegalStateException if the formula contains a quantifier
   */
  boolean holds(long value);

  boolean isQuantifierFree();

  /** Adds the variables of this formula that are not contained in {@code bound} to {@code free}. */
  void collectVariables(Set<String> bound, Set<String> free);

  default Set<String> freeVariables() {
    Set<String> free = new HashSet<>();
    collectVariables(Set.of(), free);
    return Set.copyOf(free);
  }

  enum Relation {
    EQ("="), NEQ("!="), LT("<"), LE("<="), GT(">"), GE(">=");

    private final String symbol;

    Relation(String symbol) {
      this.symbol = symbol;
    }

    public boolean test(long left, long right) {
      return switch (this) {
        case EQ -> left == right;
        case NEQ -> left != right;
        case LT -> left < right;
        case LE -> left <= right;
        case GT -> left > right;
        case GE -> left >= right;
      };
    }

    public String symbol() {
      return symbol;
    }
  }

  enum Quantifier {
    FORALL, EXISTS;

    @Override
    public String toString() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  record Literal(boolean value) implements TimeFormula {
    @Override
    public boolean holds(long ignored) {
      return value;
    }

    @Override
    public boolean isQuantifierFree() {
      return true;
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

  record Conjunction(List<TimeFormula> operands) implements TimeFormula {
    public Conjunction {
      checkArgument(!operands.isEmpty(), "Empty conjunction");
      operands = List.copyOf(operands);
    }

    @Override
    public boolean holds(long value) {
      return operands.stream().allMatch(operand -> operand.holds(value));
    }

    @Override
    public boolean isQuantifierFree() {
      return operands.stream().allMatch(TimeFormula::isQuantifierFree);
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      operands.forEach(operand -> operand.collectVariables(bound, free));
    }

    @Override
    public String toString() {
      return operands.stream().map(TimeFormula::toString).collect(Collectors.joining(" ", "(and ", ")"));
    }
  }

  record Disjunction(List<TimeFormula> operands) implements TimeFormula {
    public Disjunction {
      checkArgument(!operands.isEmpty(), "Empty disjunction");
      operands = List.copyOf(operands);
    }

    @Override
    public boolean holds(long value) {
      return operands.stream().anyMatch(operand -> operand.holds(value));
    }

    @Override
    public boolean isQuantifierFree() {
      return operands.stream().allMatch(TimeFormula::isQuantifierFree);
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      operands.forEach(operand -> operand.collectVariables(bound, free));
    }

    @Override
    public String toString() {
      return operands.stream().map(TimeFormula::toString).collect(Collectors.joining(" ", "(or ", ")"));
    }
  }

  record Negation(TimeFormula operand) implements TimeFormula {
    public Negation {
      requireNonNull(operand);
    }

    @Override
    public boolean holds(long value) {
      return !operand.holds(value);
    }

    @Override
    public boolean isQuantifierFree() {
      return operand.isQuantifierFree();
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      operand.collectVariables(bound, free);
    }

    @Override
    public String toString() {
      return "(not %s)".formatted(operand);
    }
  }

  record Comparison(Relation relation, TimeExpression left, TimeExpression right) implements TimeFormula {
    public Comparison {
      requireNonNull(relation);
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public boolean holds(long value) {
      return relation.test(left.evaluate(value), right.evaluate(value));
    }

    @Override
    public boolean isQuantifierFree() {
      return true;
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      left.collectVariables(bound, free);
      right.collectVariables(bound, free);
    }

    @Override
    public String toString() {
      return "(%s %s %s)".formatted(relation.symbol(), left, right);
    }
  }

  record Quantified(Quantifier quantifier, String variable, TimeFormula body) implements TimeFormula {
    public Quantified {
      requireNonNull(quantifier);
      requireNonNull(variable);
      requireNonNull(body);
    }

    @Override
    public boolean holds(long value) {
      throw new IllegalStateException("Cannot evaluate quantified formula " + this);
    }

    @Override
    public boolean isQuantifierFree() {
      return false;
    }

    @Override
    public void collectVariables(Set<String> bound, Set<String> free) {
      Set<String> inner = new HashSet<>(bound);
      inner.add(variable);
      body.collectVariables(inner, free);
    }

    @Override
    public String toString() {
      return "(%s %s %s)".formatted(quantifier, variable, body);
    }
  }
}
