package eqlib.engine.match;

import eqlib.engine.expr.Expr;
import eqlib.engine.expr.ExprException;
import eqlib.engine.expr.FunctionExpr;
import eqlib.engine.expr.NumberExpr;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static eqlib.engine.expr.ExprException.Kind.BINDING_CONFLICT;

/**
 * Matches concrete expressions against patterns. A pattern node is a placeholder if it is
 * flagged generic or its id is among the caller's generic ids. Matching never throws for a
 * mismatch; it returns {@link ExprMatchResult#noMatch()}.
 */
public abstract class ExprMatcher {
  private ExprMatcher() {}

  public static ExprMatchResult matchSuperset(Expr expr, Expr pattern) {
    return matchSuperset(expr, pattern, Set.of());
  }

  /**
   * @throws ExprException BINDING_CONFLICT if the pattern applies one generic function to two
   *     different argument lists, whatever `expr` is
   */
  public static ExprMatchResult matchSuperset(Expr expr, Expr pattern, Set<Integer> genericIds) {
    checkDependentVars(pattern, genericIds, new HashMap<>());
    return match0(expr, pattern, genericIds);
  }

  private static ExprMatchResult match0(Expr expr, Expr pattern, Set<Integer> genericIds) {
    if (pattern instanceof NumberExpr) {
      return pattern.equals(expr) ? ExprMatchResult.empty() : ExprMatchResult.noMatch();
    }

    final FunctionExpr patternFunc = (FunctionExpr) pattern;
    final boolean placeholder = isPlaceholder(patternFunc, genericIds);

    // ?x
    if (placeholder && patternFunc.isSymbol()) return ExprMatchResult.bind(patternFunc.id(), expr);

    if (!(expr instanceof FunctionExpr func)) return ExprMatchResult.noMatch();
    if (func.args().size() != patternFunc.args().size()) return ExprMatchResult.noMatch();

    final ExprMatchResult head;
    if (placeholder) {
      // ?f(x): an unknown function, bound to the whole application
      head = ExprMatchResult.bindFunction(patternFunc.id(), func, patternFunc.args());
    } else if (func.id() == patternFunc.id() && !func.isGeneric()) {
      head = ExprMatchResult.empty();
    } else {
      return ExprMatchResult.noMatch();
    }

    return head.merge(matchArguments(func.args(), patternFunc.args(), genericIds));
  }

  private static ExprMatchResult matchArguments(
      List<Expr> args, List<Expr> patternArgs, Set<Integer> genericIds) {
    ExprMatchResult result = ExprMatchResult.empty();
    for (int i = 0, bound = args.size(); i < bound; ++i) {
      final ExprMatchResult argResult = match0(args.get(i), patternArgs.get(i), genericIds);
      result = result.merge(argResult);
      if (result.failed()) return result;
    }
    return result;
  }

  private static void checkDependentVars(
      Expr pattern, Set<Integer> genericIds, Map<Integer, List<Expr>> declared) {
    if (!(pattern instanceof FunctionExpr func) || func.isSymbol()) return;

    if (isPlaceholder(func, genericIds)) {
      final List<Expr> existing = declared.putIfAbsent(func.id(), func.args());
      if (existing != null && !existing.equals(func.args()))
        throw new ExprException(BINDING_CONFLICT, "generic functions must have the same arguments");
    }
    for (Expr arg : func.args()) checkDependentVars(arg, genericIds, declared);
  }

  static boolean isPlaceholder(FunctionExpr pattern, Set<Integer> genericIds) {
    return pattern.isGeneric() || genericIds.contains(pattern.id());
  }
}
