package eqlib.engine.expr;

import com.google.common.base.Preconditions;
import eqlib.engine.match.ExprMatchResult;
import eqlib.engine.match.ExprMatcher;
import eqlib.engine.match.ExprSubstitution;

import static eqlib.engine.expr.ExprException.Kind.NO_MATCH;

/**
 * A pair of expressions. Read as an equation (both sides are equal) or as a rewrite
 * instruction (replace what matches `left` by `right`).
 */
public record Rule(Expr left, Expr right) {
  /** Stands for the wrapped side in {@link #envelop}. */
  public static final FunctionExpr INNER_EXPR = FunctionExpr.mkSymbol(0);

  public Rule {
    Preconditions.checkNotNull(left);
    Preconditions.checkNotNull(right);
  }

  public Rule reversed() {
    return new Rule(right, left);
  }

  /** Substitutes `rule` at its first match, searching the left side before the right. */
  public Rule substitute(Rule rule) {
    final int leftPos = ExprSubstitution.findFirst(left, rule.left());
    if (leftPos >= 0) return new Rule(left.substituteAt(rule, leftPos), right);

    final int rightPos = ExprSubstitution.findFirst(right, rule.left());
    if (rightPos >= 0) return new Rule(left, right.substituteAt(rule, rightPos));

    return this;
  }

  /** Positions count through the left side first, then continue into the right side. */
  public Rule substituteAt(Rule rule, int position) {
    if (position >= 0 && position < left.size())
      return new Rule(left.substituteAt(rule, position), right);
    return new Rule(left, right.substituteAt(rule, position - left.size()));
  }

  /**
   * Wraps both sides with `wrapper`. `template` is matched against the left side, or the right
   * side if that fails; the resulting bindings and the side itself (in place of {@link
   * #INNER_EXPR}) are substituted into `wrapper`.
   */
  public Rule envelop(Expr template, Expr wrapper) {
    ExprMatchResult match = ExprMatcher.matchSuperset(left, template);
    if (match.failed()) match = ExprMatcher.matchSuperset(right, template);
    if (match.failed()) throw new ExprException(NO_MATCH, "envelop template matches neither side");

    final Expr remapped = ExprSubstitution.rewrite(match, wrapper);

    return new Rule(
        ExprSupport.replaceAll(remapped, INNER_EXPR, left),
        ExprSupport.replaceAll(remapped, INNER_EXPR, right));
  }

  public Rule evaluate(ExprContext ctx) {
    return new Rule(left.evaluate(ctx), right.evaluate(ctx));
  }

  public String toString(ExprContext ctx) {
    return left.toString(ctx) + " = " + right.toString(ctx);
  }

  @Override
  public String toString() {
    return left + " = " + right;
  }
}
