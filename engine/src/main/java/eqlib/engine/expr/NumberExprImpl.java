package eqlib.engine.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;

final class NumberExprImpl implements NumberExpr {
  private final double value;

  NumberExprImpl(double value) {
    this.value = value;
  }

  @Override
  public double value() {
    return value;
  }

  @Override
  public List<Expr> args() {
    return ImmutableList.of();
  }

  @Override
  public int size() {
    return 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NumberExpr that)) return false;
    return Double.compare(value, that.value()) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value);
  }

  @Override
  public String toString(ExprContext ctx) {
    return toString();
  }

  @Override
  public String toString() {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15)
      return Long.toString((long) value);
    return Double.toString(value);
  }
}
