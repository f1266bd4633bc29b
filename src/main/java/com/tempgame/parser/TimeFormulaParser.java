package com.tempgame.parser;

import static com.google.common.base.Preconditions.checkState;

import com.tempgame.grammar.TimeConstraintBaseVisitor;
import com.tempgame.grammar.TimeConstraintParser;
import com.tempgame.model.TimeExpression;
import com.tempgame.model.TimeFormula;
import java.util.List;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ErrorNode;

/**
 * Builds {@link TimeFormula}s from edge guards in s-expression syntax, e.g. {@code (>= x 5)} or
 * {@code (and (= (mod x 5) 0) (not (< x 10)))}.
 */
public class TimeFormulaParser extends TimeConstraintBaseVisitor<TimeFormula> {
  private static final TermParser TERMS = new TermParser();

  /**
   * Parses the given guard.
   *
   * @throws IllegalArgumentException if the text is not a well-formed formula
   */
  public static TimeFormula parse(String text) {
    return ParseUtil.parse(text, new TimeFormulaParser());
  }

  @Override
  public TimeFormula visitConstraint(TimeConstraintParser.ConstraintContext ctx) {
    return visit(ctx.formula());
  }

  @Override
  public TimeFormula visitTrueFormula(TimeConstraintParser.TrueFormulaContext ctx) {
    return TimeFormula.TRUE;
  }

  @Override
  public TimeFormula visitFalseFormula(TimeConstraintParser.FalseFormulaContext ctx) {
    return TimeFormula.FALSE;
  }

  @Override
  public TimeFormula visitConjunction(TimeConstraintParser.ConjunctionContext ctx) {
    return new TimeFormula.Conjunction(operands(ctx.formula()));
  }

  @Override
  public TimeFormula visitDisjunction(TimeConstraintParser.DisjunctionContext ctx) {
    return new TimeFormula.Disjunction(operands(ctx.formula()));
  }

  @Override
  public TimeFormula visitNegation(TimeConstraintParser.NegationContext ctx) {
    return new TimeFormula.Negation(visit(ctx.operand));
  }

  @Override
  public TimeFormula visitComparison(TimeConstraintParser.ComparisonContext ctx) {
    return new TimeFormula.Comparison(relation(ctx.relation()), TERMS.visit(ctx.left), TERMS.visit(ctx.right));
  }

  @Override
  public TimeFormula visitQuantified(TimeConstraintParser.QuantifiedContext ctx) {
    TimeFormula.Quantifier quantifier = ctx.quantifier().FORALL() != null
        ? TimeFormula.Quantifier.FORALL
        : TimeFormula.Quantifier.EXISTS;
    return new TimeFormula.Quantified(quantifier, ctx.bound.getText(), visit(ctx.body));
  }

  @Override
  public TimeFormula visitErrorNode(ErrorNode node) {
    throw new ParseCancellationException("Unexpected " + node.getText());
  }

  private List<TimeFormula> operands(List<TimeConstraintParser.FormulaContext> contexts) {
    checkState(!contexts.isEmpty());
    return contexts.stream().map(this::visit).toList();
  }

  private static TimeFormula.Relation relation(TimeConstraintParser.RelationContext ctx) {
    if (ctx.EQ() != null) {
      return TimeFormula.Relation.EQ;
    }
    if (ctx.NEQ() != null) {
      return TimeFormula.Relation.NEQ;
    }
    if (ctx.LT() != null) {
      return TimeFormula.Relation.LT;
    }
    if (ctx.LE() != null) {
      return TimeFormula.Relation.LE;
    }
    if (ctx.GT() != null) {
      return TimeFormula.Relation.GT;
    }
    if (ctx.GE() != null) {
      return TimeFormula.Relation.GE;
    }
    throw new ParseCancellationException("Unknown relation " + ctx.getText());
  }

  private static long integer(TimeConstraintParser.IntegerContext ctx) {
    String digits = ctx.INTEGER().getText();
    return Long.parseLong(ctx.MINUS() == null ? digits : "-" + digits);
  }

  private static final class TermParser extends TimeConstraintBaseVisitor<TimeExpression> {
    @Override
    public TimeExpression visitConstant(TimeConstraintParser.ConstantContext ctx) {
      return new TimeExpression.Constant(integer(ctx.integer()));
    }

    @Override
    public TimeExpression visitVariable(TimeConstraintParser.VariableContext ctx) {
      return new TimeExpression.Variable(ctx.name.getText());
    }

    @Override
    public TimeExpression visitSum(TimeConstraintParser.SumContext ctx) {
      return new TimeExpression.Sum(visit(ctx.left), visit(ctx.right));
    }

    @Override
    public TimeExpression visitDifference(TimeConstraintParser.DifferenceContext ctx) {
      return new TimeExpression.Difference(visit(ctx.left), visit(ctx.right));
    }

    @Override
    public TimeExpression visitProduct(TimeConstraintParser.ProductContext ctx) {
      return new TimeExpression.Product(integer(ctx.factor), visit(ctx.inner));
    }

    @Override
    public TimeExpression visitRemainder(TimeConstraintParser.RemainderContext ctx) {
      return new TimeExpression.Remainder(visit(ctx.inner), integer(ctx.modulus));
    }

    @Override
    public TimeExpression visitErrorNode(ErrorNode node) {
      throw new ParseCancellationException("Unexpected " + node.getText());
    }
  }
}
