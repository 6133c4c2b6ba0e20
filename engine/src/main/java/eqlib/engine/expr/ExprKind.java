package eqlib.engine.expr;

public enum ExprKind {
  NUMBER,
  FUNCTION
}
