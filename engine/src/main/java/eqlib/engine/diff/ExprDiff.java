package eqlib.engine.diff;

import eqlib.engine.expr.Expr;
import eqlib.engine.expr.FunctionExpr;
import eqlib.engine.expr.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the smallest rewrite that explains the difference between two expressions. In
 * order of preference a node is unchanged, reordered, resolved per argument, or replaced
 * wholesale.
 */
public class ExprDiff {
  private static final Logger LOG = Logger.getLogger(ExprDiff.class.getName());

  private final RearrangementSolver solver;

  public ExprDiff(Set<Integer> rearrangeableIds) {
    this.solver = new RearrangementSolver(rearrangeableIds);
  }

  public static ExprDiffResult diff(Expr a, Expr b, Set<Integer> rearrangeableIds) {
    return new ExprDiff(rearrangeableIds).diff(a, b);
  }

  /**
   * Diff of two whole expressions. Unequal numbers at the root are replaced as a whole, the
   * result still carries the numeric inequality flag.
   */
  public ExprDiffResult diff(Expr a, Expr b) {
    final ExprDiffResult result = diff(a, b, 0);
    if (result.numericInequality())
      return new ExprDiffResult(ExprDiffBranch.replace(0, new Rule(a, b)), true);
    return result;
  }

  /** Diff of sub-trees `a` and `b`, where `position` is the address of `a` in its root. */
  public ExprDiffResult diff(Expr a, Expr b, int position) {
    if (a.equals(b)) return ExprDiffResult.of(ExprDiffBranch.same(position));

    // Any rule for this pair would equate two different numbers.
    if (a.isNumber() && b.isNumber()) return ExprDiffResult.irreconcilable();

    final ExprDiffBranch replace = ExprDiffBranch.replace(position, new Rule(a, b));

    final List<Rearrangement> rearrangements = solver.computeRearrangement(position, a, b);
    if (!rearrangements.isEmpty()) return ExprDiffResult.of(replace.withRearrangements(rearrangements));

    if (!isAlignable(a, b)) return ExprDiffResult.of(replace);

    final List<Expr> argsA = a.args(), argsB = b.args();
    final List<ExprDiffBranch> argumentDifference = new ArrayList<>(argsA.size());
    int argPosition = position + 1;
    for (int i = 0, bound = argsA.size(); i < bound; ++i) {
      final ExprDiffResult argResult = diff(argsA.get(i), argsB.get(i), argPosition);
      if (argResult.numericInequality()) {
        LOG.log(Level.FINE, "numeric inequality below {0}, replacing {1}", new Object[] {position, a});
        return ExprDiffResult.of(replace);
      }
      argumentDifference.add(argResult.branch());
      argPosition += argsA.get(i).size();
    }

    return ExprDiffResult.of(replace.withArgumentDifference(argumentDifference));
  }

  private static boolean isAlignable(Expr a, Expr b) {
    return a instanceof FunctionExpr funcA
        && b instanceof FunctionExpr funcB
        && !funcA.isSymbol()
        && funcA.id() == funcB.id()
        && funcA.isGeneric() == funcB.isGeneric()
        && funcA.args().size() == funcB.args().size();
  }
}
