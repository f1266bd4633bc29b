package com.tempgame.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tempgame.model.TimeFormula.Comparison;
import com.tempgame.model.TimeFormula.Relation;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class TimeConstraintTest {
  private static final TimeExpression X = new TimeExpression.Variable("x");
  private static final TimeExpression Y = new TimeExpression.Variable("y");

  private static TimeExpression constant(long value) {
    return new TimeExpression.Constant(value);
  }

  private static TimeExpression mod(TimeExpression inner, long modulus) {
    return new TimeExpression.Remainder(inner, modulus);
  }

  private static void assertUltimatelyPeriodic(TimeConstraint constraint) {
    int from = constraint.stableFrom();
    int period = constraint.period();
    for (int time = from; time < from + 5 * period + 50; time++) {
      assertEquals(constraint.test(time), constraint.test(time + period), "%s at %d".formatted(constraint, time));
    }
  }

  @Test
  void quantifierFreeness() {
    assertTrue(new Comparison(Relation.EQ, X, constant(1)).isQuantifierFree());
    assertFalse(new TimeFormula.Quantified(TimeFormula.Quantifier.FORALL, "x",
        new Comparison(Relation.EQ, X, constant(2))).isQuantifierFree());
    assertTrue(new TimeFormula.Conjunction(List.of(
        new Comparison(Relation.EQ, Y, constant(3)),
        new Comparison(Relation.NEQ, new TimeExpression.Variable("z"), constant(4)))).isQuantifierFree());
    assertFalse(new TimeFormula.Disjunction(List.of(
        new Comparison(Relation.EQ, new TimeExpression.Variable("a"), constant(5)),
        new TimeFormula.Quantified(TimeFormula.Quantifier.EXISTS, "b",
            new Comparison(Relation.EQ, new TimeExpression.Variable("b"), constant(6))))).isQuantifierFree());
  }

  @Test
  void freeVariables() {
    assertEquals(Set.of("x"), new Comparison(Relation.EQ, X, constant(1)).freeVariables());
    assertEquals(Set.of("y"), new TimeFormula.Quantified(TimeFormula.Quantifier.FORALL, "x",
        new Comparison(Relation.EQ, X, Y)).freeVariables());
    assertEquals(Set.of("x", "y"), new TimeFormula.Quantified(TimeFormula.Quantifier.EXISTS, "z",
        new TimeFormula.Conjunction(List.of(
            new Comparison(Relation.EQ, X, new TimeExpression.Variable("z")),
            new Comparison(Relation.EQ, Y, constant(0))))).freeVariables());
  }

  @Test
  void compilesToTimePredicate() {
    TimeConstraint sum = TimeConstraint.of(
        new Comparison(Relation.EQ, new TimeExpression.Sum(X, constant(2)), constant(5)));
    assertTrue(sum.test(3));
    assertFalse(sum.test(2));

    assertTrue(TimeConstraint.ALWAYS.test(0));
    assertTrue(TimeConstraint.ALWAYS.test(42));
    assertFalse(TimeConstraint.of(TimeFormula.FALSE).test(7));

    assertThrows(IllegalArgumentException.class, () -> TimeConstraint.of(new TimeFormula.Quantified(
        TimeFormula.Quantifier.FORALL, "x", new Comparison(Relation.EQ, X, constant(1)))));
    assertThrows(IllegalArgumentException.class, () -> TimeConstraint.of(
        new Comparison(Relation.EQ, new TimeExpression.Sum(X, Y), constant(5))));
  }

  @Test
  void thresholdSettlesAfterConstant() {
    TimeConstraint late = TimeConstraint.of(new Comparison(Relation.GE, X, constant(5)));

    assertFalse(late.test(4));
    assertTrue(late.test(5));
    assertEquals(1, late.period());
    assertTrue(late.stableFrom() >= 5);
    assertUltimatelyPeriodic(late);
  }

  @Test
  void residuesRepeatWithModulus() {
    TimeConstraint everyFifth = TimeConstraint.of(new Comparison(Relation.EQ, mod(X, 5), constant(0)));

    assertTrue(everyFifth.test(0));
    assertTrue(everyFifth.test(10));
    assertFalse(everyFifth.test(11));
    assertEquals(5, everyFifth.period());
    assertUltimatelyPeriodic(everyFifth);
  }

  @Test
  void mixedGuardsAreUltimatelyPeriodic() {
    List<TimeFormula> formulas = List.of(
        new Comparison(Relation.LT, new TimeExpression.Product(3, mod(X, 4)), X),
        new Comparison(Relation.EQ, mod(new TimeExpression.Difference(X, constant(7)), 3), constant(-1)),
        new Comparison(Relation.GT, mod(new TimeExpression.Sum(new TimeExpression.Product(-2, X), mod(X, 6)), 4),
            constant(-2)),
        new TimeFormula.Disjunction(List.of(
            new Comparison(Relation.LE, X, constant(12)),
            new TimeFormula.Negation(new Comparison(Relation.NEQ, mod(X, 7), constant(3))))),
        new TimeFormula.Conjunction(List.of(
            new Comparison(Relation.GE, new TimeExpression.Product(2, X), constant(9)),
            new Comparison(Relation.EQ, mod(mod(X, 10), 4), constant(1)))));
    for (TimeFormula formula : formulas) {
      assertUltimatelyPeriodic(TimeConstraint.of(formula));
    }
  }

  @Test
  void zeroModulusIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> mod(X, 0));
  }
}
