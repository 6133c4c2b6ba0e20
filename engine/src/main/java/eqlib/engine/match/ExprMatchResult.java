package eqlib.engine.match;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import eqlib.engine.expr.Expr;
import eqlib.engine.expr.ExprException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static eqlib.engine.expr.ExprException.Kind.BINDING_CONFLICT;

/**
 * Outcome of matching a concrete expression against a pattern. A successful result holds the
 * bindings of generic ids and, for each generic function matched, the argument expressions of
 * the pattern (its dependent variables).
 */
public final class ExprMatchResult {
  private static final ExprMatchResult FAILED = new ExprMatchResult(false, ImmutableMap.of(), ImmutableMap.of());
  private static final ExprMatchResult EMPTY = new ExprMatchResult(true, ImmutableMap.of(), ImmutableMap.of());

  private final boolean matched;
  private final ImmutableMap<Integer, Expr> bindings;
  private final ImmutableMap<Integer, List<Expr>> dependentVars;

  private ExprMatchResult(
      boolean matched, Map<Integer, Expr> bindings, Map<Integer, List<Expr>> dependentVars) {
    this.matched = matched;
    this.bindings = ImmutableMap.copyOf(bindings);
    this.dependentVars = ImmutableMap.copyOf(dependentVars);
  }

  public static ExprMatchResult noMatch() {
    return FAILED;
  }

  public static ExprMatchResult empty() {
    return EMPTY;
  }

  public static ExprMatchResult bind(int id, Expr expr) {
    return new ExprMatchResult(true, ImmutableMap.of(id, expr), ImmutableMap.of());
  }

  static ExprMatchResult bindFunction(int id, Expr expr, List<Expr> dependentVars) {
    return new ExprMatchResult(
        true, ImmutableMap.of(id, expr), ImmutableMap.of(id, ImmutableList.copyOf(dependentVars)));
  }

  public boolean matched() {
    return matched;
  }

  public boolean failed() {
    return !matched;
  }

  public Map<Integer, Expr> bindings() {
    return bindings;
  }

  public Map<Integer, List<Expr>> dependentVars() {
    return dependentVars;
  }

  /**
   * Merges two partial results. Fails if either side failed or if a generic id would be bound to
   * two unequal expressions. A generic function declared with two different argument lists is a
   * hard conflict.
   */
  public ExprMatchResult merge(ExprMatchResult other) {
    if (failed() || other.failed()) return FAILED;
    if (other.bindings.isEmpty() && other.dependentVars.isEmpty()) return this;
    if (bindings.isEmpty() && dependentVars.isEmpty()) return other;

    // checked before the bindings, so an inconsistent pattern fails whatever it is matched against
    final Map<Integer, List<Expr>> mergedVars = new LinkedHashMap<>(dependentVars);
    for (var e : other.dependentVars.entrySet()) {
      final List<Expr> existing = mergedVars.putIfAbsent(e.getKey(), e.getValue());
      if (existing != null && !existing.equals(e.getValue()))
        throw new ExprException(BINDING_CONFLICT, "generic functions must have the same arguments");
    }

    final Map<Integer, Expr> mergedBindings = new LinkedHashMap<>(bindings);
    for (var e : other.bindings.entrySet()) {
      final Expr existing = mergedBindings.putIfAbsent(e.getKey(), e.getValue());
      if (existing != null && !existing.equals(e.getValue())) return FAILED;
    }

    return new ExprMatchResult(true, mergedBindings, mergedVars);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ExprMatchResult that)) return false;
    return matched == that.matched
        && bindings.equals(that.bindings)
        && dependentVars.equals(that.dependentVars);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Boolean.hashCode(matched) + bindings.hashCode()) + dependentVars.hashCode();
  }

  @Override
  public String toString() {
    return matched ? "Match" + bindings : "NoMatch";
  }
}
