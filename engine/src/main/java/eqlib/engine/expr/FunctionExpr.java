package eqlib.engine.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Application of a function id to arguments. A generic function expression is a pattern
 * placeholder: a generic symbol binds to any expression, a generic function with arguments
 * binds to an unknown function application.
 */
public interface FunctionExpr extends Expr {
  @Override
  default ExprKind kind() {
    return ExprKind.FUNCTION;
  }

  int id();

  @Override
  boolean isGeneric();

  static FunctionExpr mk(int id, boolean generic, List<? extends Expr> args) {
    return new FunctionExprImpl(id, generic, ImmutableList.copyOf(args));
  }

  static FunctionExpr mk(int id, List<? extends Expr> args) {
    return mk(id, false, args);
  }

  static FunctionExpr mk(int id, Expr... args) {
    return mk(id, false, ImmutableList.copyOf(args));
  }

  static FunctionExpr mkSymbol(int id) {
    return mk(id, false, ImmutableList.of());
  }

  static FunctionExpr mkGeneric(int id, Expr... args) {
    return mk(id, true, ImmutableList.copyOf(args));
  }

  /** Same id and generic flag, new arguments. */
  default FunctionExpr withArgs(List<? extends Expr> args) {
    return mk(id(), isGeneric(), args);
  }
}
