package eqlib.engine.expr;

import com.google.common.base.Preconditions;

public interface NumberExpr extends Expr {
  @Override
  default ExprKind kind() {
    return ExprKind.NUMBER;
  }

  double value();

  static NumberExpr mk(double value) {
    Preconditions.checkArgument(!Double.isNaN(value), "NaN is not a numeric expression");
    // -0.0 and 0.0 must compare and hash the same
    return new NumberExprImpl(value == 0.0 ? 0.0 : value);
  }
}
