package eqlib.engine.match;

import com.google.common.collect.ImmutableList;
import eqlib.engine.expr.Expr;
import eqlib.engine.expr.ExprException;
import eqlib.engine.expr.ExprSupport;
import eqlib.engine.expr.FunctionExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static eqlib.common.utils.ListSupport.map;
import static eqlib.engine.expr.ExprException.Kind.BINDING_CONFLICT;
import static eqlib.engine.expr.ExprException.Kind.INFERENCE_FAILURE;
import static eqlib.engine.expr.ExprException.Kind.MALFORMED_PATTERN;

/**
 * Bindings of generic ids collected over one rewrite attempt, plus the dependent variables
 * declared for generic functions (for the pattern `f(x)`, `f` depends on `[x]`).
 *
 * <p>Not shared between attempts: every substitution creates its own mapping.
 */
public class ExprMapping {
  private static final Logger LOG = Logger.getLogger(ExprMapping.class.getName());

  /** Only a single dependent variable per generic function is accepted. Cannot be disabled. */
  public static final boolean STRICT_MODE = true;

  private final Set<Integer> genericIds;
  private final Map<Integer, Expr> substitute;
  private final Map<Integer, List<Integer>> dependantVars;

  public ExprMapping() {
    this(Set.of());
  }

  /** `genericIds` are treated as placeholders by {@link #remap} even when not flagged generic. */
  public ExprMapping(Set<Integer> genericIds) {
    this.genericIds = genericIds;
    this.substitute = new HashMap<>();
    this.dependantVars = new HashMap<>();
  }

  public boolean addExpression(int id, Expr targetExpr) {
    return addExpression(id, targetExpr, Collections.emptyList());
  }

  /**
   * Binds `id` to `targetExpr`. Returns false, leaving the existing binding untouched, if `id` is
   * already bound to a different expression.
   *
   * @param targetVars dependent variables of a generic function; each must be a generic symbol
   * @throws ExprException MALFORMED_PATTERN for an illegal dependent variable list,
   *     BINDING_CONFLICT if the list differs from the one recorded earlier
   */
  public boolean addExpression(int id, Expr targetExpr, List<Expr> targetVars) {
    if (!targetVars.isEmpty()) {
      if (STRICT_MODE && targetVars.size() > 1)
        throw new ExprException(
            MALFORMED_PATTERN, "in strict mode multiple dependant variables are not allowed");

      final List<Integer> ids = new ArrayList<>(targetVars.size());
      for (Expr var : targetVars) {
        if (var instanceof FunctionExpr func && func.isGeneric() && func.isSymbol()) ids.add(func.id());
        else throw new ExprException(MALFORMED_PATTERN, "dependant variables must be generic symbols");
      }

      final List<Integer> existing = dependantVars.putIfAbsent(id, ImmutableList.copyOf(ids));
      if (existing != null && !existing.equals(ids))
        throw new ExprException(BINDING_CONFLICT, "generic functions must have the same arguments");
    }

    final Expr existing = substitute.putIfAbsent(id, targetExpr);
    return existing == null || existing.equals(targetExpr);
  }

  /**
   * Adds all bindings of a successful match.
   *
   * @throws ExprException BINDING_CONFLICT if a binding contradicts one already present
   */
  public void addAll(ExprMatchResult match) {
    if (match.failed()) throw new IllegalArgumentException("cannot add a failed match");

    for (var e : match.bindings().entrySet()) {
      final int id = e.getKey();
      final List<Expr> vars = match.dependentVars().getOrDefault(id, Collections.emptyList());
      if (!addExpression(id, e.getValue(), vars))
        throw new ExprException(BINDING_CONFLICT, "generic " + id + " is already bound to " + substitute.get(id));
    }
  }

  /**
   * Dependent variables of the generic function `fnId`. Unbound ones are inferred: if `fnId` is
   * bound to a function with exactly one argument, its only dependent variable binds to that
   * argument.
   *
   * @throws ExprException INFERENCE_FAILURE if an unbound variable cannot be inferred
   */
  public List<Integer> getDependantVars(int fnId) {
    final List<Integer> depVars = dependantVars.getOrDefault(fnId, Collections.emptyList());
    for (int varId : depVars) {
      if (substitute.containsKey(varId)) continue;

      final Expr fn = substitute.get(fnId);
      if (depVars.size() == 1 && fn instanceof FunctionExpr func && func.args().size() == 1) {
        substitute.put(varId, func.args().get(0));
        LOG.log(Level.FINER, "inferred dependant variable {0} of {1}", new Object[] {varId, fnId});
      } else {
        throw new ExprException(INFERENCE_FAILURE, "dependant variable cannot be inferred");
      }
    }
    return depVars;
  }

  /** Infers every dependent variable now, so remapping cannot fail halfway. */
  public void finalizeMapping() {
    for (int fnId : new ArrayList<>(dependantVars.keySet())) getDependantVars(fnId);
  }

  public boolean isBound(int id) {
    return substitute.containsKey(id);
  }

  public Expr get(int id) {
    return substitute.get(id);
  }

  public Map<Integer, Expr> bindings() {
    return Collections.unmodifiableMap(substitute);
  }

  /**
   * Replaces every bound placeholder in `expr`. For a generic function application `f(u)` with
   * `f` bound to `g(y)` and dependent variable `x` bound to `y`, the result is `g(y)` with `y`
   * replaced by the remapped `u`.
   */
  public Expr remap(Expr expr) {
    if (!(expr instanceof FunctionExpr func)) return expr;

    final boolean placeholder = ExprMatcher.isPlaceholder(func, genericIds);
    if (placeholder && substitute.containsKey(func.id())) {
      final Expr bound = substitute.get(func.id());
      if (func.isSymbol()) return bound;

      final List<Integer> depVars = getDependantVars(func.id());
      if (depVars.size() != func.args().size())
        throw new ExprException(MALFORMED_PATTERN, "generic functions must have the same arguments");

      Expr result = bound;
      for (int i = 0; i < depVars.size(); ++i) {
        final Expr varExpr = substitute.get(depVars.get(i));
        result = ExprSupport.replaceAll(result, varExpr, remap(func.args().get(i)));
      }
      return result;
    }

    if (func.isSymbol()) return func;
    return func.withArgs(map(func.args(), this::remap));
  }

  @Override
  public String toString() {
    return "ExprMapping" + substitute + (dependantVars.isEmpty() ? "" : " depends " + dependantVars);
  }
}
