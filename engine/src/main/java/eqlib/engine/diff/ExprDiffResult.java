package eqlib.engine.diff;

/**
 * Result of diffing two expressions. `numericInequality` marks two unequal numbers: no rule at
 * this node can reconcile them, so an ancestor has to be replaced instead.
 */
public record ExprDiffResult(ExprDiffBranch branch, boolean numericInequality) {
  public static ExprDiffResult of(ExprDiffBranch branch) {
    return new ExprDiffResult(branch, false);
  }

  static ExprDiffResult irreconcilable() {
    return new ExprDiffResult(null, true);
  }
}
