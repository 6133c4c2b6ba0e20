package eqlib.engine.expr;

/**
 * Identifier resolution and arithmetic supplied by the caller. The engine never interprets
 * operator ids itself; it only asks this capability.
 */
public interface ExprContext {
  int resolve(String name);

  String resolveName(int id);

  boolean canCompute(int id);

  double compute(int id, double[] args);
}
