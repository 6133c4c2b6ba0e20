package eqlib.engine.expr;

import eqlib.engine.match.ExprSubstitution;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * An expression tree. Either a numeric leaf ({@link NumberExpr}) or the application of a
 * function id to an ordered argument list ({@link FunctionExpr}). A function without
 * arguments is a symbol.
 *
 * <p>Expressions are immutable. Every operation that changes a tree returns a new one.
 * Equality and hash code are structural and sensitive to argument order.
 *
 * <p>Positions are offsets into the pre-order flattening of the expression the method is
 * invoked on (the receiver itself has position 0).
 */
public interface Expr {

  ExprKind kind();

  /** Arguments of a function application. Empty for numbers and symbols. */
  List<Expr> args();

  default boolean isNumber() {
    return kind() == ExprKind.NUMBER;
  }

  default boolean isFunction() {
    return kind() == ExprKind.FUNCTION;
  }

  default boolean isSymbol() {
    return kind() == ExprKind.FUNCTION && args().isEmpty();
  }

  default boolean isGeneric() {
    return false;
  }

  /** Node count, the length of {@link #flatten()}. */
  int size();

  default List<Expr> flatten() {
    final List<Expr> nodes = new ArrayList<>(size());
    ExprSupport.flattenTo(this, nodes);
    return nodes;
  }

  /** Pre-order offsets of every sub-tree structurally equal to `target`. */
  default List<Integer> search(Expr target) {
    return ExprSupport.search(this, target);
  }

  /** Sub-tree at `position`. Throws ADDRESS_NOT_FOUND if there is none. */
  default Expr at(int position) {
    return ExprSupport.at(this, position);
  }

  default Expr replaceAt(int position, Expr replacement) {
    return ExprSupport.replaceAt(this, position, replacement);
  }

  /** Ids of all functions and symbols in the tree. */
  default Set<Integer> functionIds() {
    return ExprSupport.functionIds(this);
  }

  /** Substitutes `rule` at the first matching node in pre-order. Returns this if none. */
  default Expr substitute(Rule rule) {
    return ExprSubstitution.substitute(this, rule);
  }

  default Expr substituteAt(Rule rule, int position) {
    return ExprSubstitution.substituteAt(this, rule, position);
  }

  default Expr rearrangeAt(List<Integer> format, int position, Set<Integer> rearrangeableIds) {
    return ExprSupport.rearrangeAt(this, format, position, rearrangeableIds);
  }

  /** Folds every computable sub-tree into a number. */
  default Expr evaluate(ExprContext ctx) {
    return ExprSupport.evaluate(this, ctx);
  }

  String toString(ExprContext ctx);
}
