package eqlib.engine.match;

import eqlib.engine.expr.Expr;
import eqlib.engine.expr.ExprException;
import eqlib.engine.expr.Rule;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static eqlib.engine.expr.ExprException.Kind.NO_MATCH;

/** Pattern-bound substitution of a {@link Rule} into an expression. */
public abstract class ExprSubstitution {
  private static final Logger LOG = Logger.getLogger(ExprSubstitution.class.getName());

  private ExprSubstitution() {}

  /** Pre-order position of the first node matching `pattern`, or -1. */
  public static int findFirst(Expr expr, Expr pattern) {
    final List<Expr> nodes = expr.flatten();
    for (int i = 0, bound = nodes.size(); i < bound; ++i) {
      if (ExprMatcher.matchSuperset(nodes.get(i), pattern).matched()) return i;
    }
    return -1;
  }

  public static Expr substitute(Expr expr, Rule rule) {
    final int position = findFirst(expr, rule.left());
    return position < 0 ? expr : substituteAt(expr, rule, position);
  }

  /**
   * @throws ExprException ADDRESS_NOT_FOUND if there is no node at `position`, NO_MATCH if the
   *     node does not match the left side of `rule`
   */
  public static Expr substituteAt(Expr expr, Rule rule, int position) {
    final Expr target = expr.at(position);
    final ExprMatchResult match = ExprMatcher.matchSuperset(target, rule.left());
    if (match.failed())
      throw new ExprException(NO_MATCH, "substitution does not match at the given position");

    final Expr replacement = rewrite(match, rule.right());
    LOG.log(Level.FINER, "substitute at {0}: {1} -> {2}", new Object[] {position, target, replacement});
    return expr.replaceAt(position, replacement);
  }

  /** Instantiates `template` with the bindings of `match`. */
  public static Expr rewrite(ExprMatchResult match, Expr template) {
    final ExprMapping mapping = new ExprMapping();
    mapping.addAll(match);
    mapping.finalizeMapping();
    return mapping.remap(template);
  }
}
