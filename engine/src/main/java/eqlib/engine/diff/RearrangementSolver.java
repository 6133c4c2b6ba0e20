package eqlib.engine.diff;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import eqlib.common.utils.Bag;
import eqlib.engine.expr.Expr;
import eqlib.engine.expr.FunctionExpr;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import static eqlib.common.utils.ListSupport.differentIndices;
import static eqlib.engine.expr.ExprSupport.FORMAT_GAP;
import static eqlib.engine.expr.ExprSupport.isRearrangeable;
import static eqlib.engine.expr.ExprSupport.rearrangeableChildren;

/**
 * Decides whether one expression is a reordering of another under commutative and
 * associative operators, and if so constructs the {@link Rearrangement} steps.
 */
public class RearrangementSolver {
  private static final Logger LOG = Logger.getLogger(RearrangementSolver.class.getName());

  private final Set<Integer> rearrangeableIds;

  public RearrangementSolver(Set<Integer> rearrangeableIds) {
    this.rearrangeableIds = ImmutableSet.copyOf(rearrangeableIds);
  }

  /**
   * Hash that ignores the order of the children of rearrangeable functions, at any depth.
   * Everything else hashes structurally.
   */
  public int canonicalHash(Expr expr) {
    if (!isRearrangeable(expr, rearrangeableIds)) return expr.hashCode();

    final FunctionExpr func = (FunctionExpr) expr;
    final int[] childHashes =
        rearrangeableChildren(func, false).stream()
            .mapToInt(child -> canonicalHash(child.getLeft()))
            .sorted()
            .toArray();
    return Objects.hash(func.id(), Arrays.hashCode(childHashes));
  }

  /**
   * Steps that turn `a` into `b`, in application order, addressed relative to the expression in
   * which `a` sits at `position`. Nested reorderings come before the reordering that contains
   * them. Empty if `b` is not a reordering of `a`.
   */
  public List<Rearrangement> computeRearrangement(int position, Expr a, Expr b) {
    if (!isRearrangeable(a, rearrangeableIds) || !isRearrangeable(b, rearrangeableIds))
      return ImmutableList.of();

    final FunctionExpr funcA = (FunctionExpr) a, funcB = (FunctionExpr) b;
    if (funcA.id() != funcB.id()) return ImmutableList.of();

    final List<Expr> argsA = funcA.args(), argsB = funcB.args();
    if (argsA.size() == argsB.size()) {
      final List<Integer> different = differentIndices(argsA, argsB);
      if (different.isEmpty()) return ImmutableList.of();

      // Cheaper than permuting the whole node if a single argument was reordered.
      if (different.size() == 1) {
        final int i = different.get(0);
        final List<Rearrangement> nested =
            computeRearrangement(position + argumentOffset(funcA, i), argsA.get(i), argsB.get(i));
        if (!nested.isEmpty()) return nested;
      }
    }

    return permute(position, funcA, funcB);
  }

  private List<Rearrangement> permute(int position, FunctionExpr a, FunctionExpr b) {
    final List<Pair<Expr, Integer>> childrenA = rearrangeableChildren(a, false);
    final List<Pair<Expr, Integer>> childrenB = rearrangeableChildren(b, true);

    final ListMultimap<Integer, Integer> slots = ArrayListMultimap.create();
    for (int i = 0; i < childrenA.size(); ++i) slots.put(canonicalHash(childrenA.get(i).getLeft()), i);

    final Bag<Integer> hashesB = new Bag<>();
    for (Pair<Expr, Integer> child : childrenB)
      if (child != null) hashesB.add(canonicalHash(child.getLeft()));

    if (!Bag.of(slots.keys()).equals(hashesB)) {
      LOG.log(Level.FINE, "no rearrangement at {0}: children differ", position);
      return ImmutableList.of();
    }

    // nested steps keyed by the offset of the child they reorder
    final TreeMap<Integer, List<Rearrangement>> nestedSteps = new TreeMap<>();
    final List<Integer> format = new ArrayList<>(childrenB.size());
    for (Pair<Expr, Integer> childB : childrenB) {
      if (childB == null) {
        format.add(FORMAT_GAP);
        continue;
      }

      final List<Integer> candidates = slots.get(canonicalHash(childB.getLeft()));
      final int index = candidates.remove(pickCandidate(candidates, childrenA, childB.getLeft()));
      format.add(index);

      final Pair<Expr, Integer> childA = childrenA.get(index);
      if (!childA.getLeft().equals(childB.getLeft())) {
        // Same canonical shape, different order inside: reorder the child first.
        final List<Rearrangement> pre =
            computeRearrangement(position + childA.getRight(), childA.getLeft(), childB.getLeft());
        if (pre.isEmpty()) {
          LOG.log(Level.FINE, "no rearrangement at {0}: hash collision on {1}", new Object[] {position, childB.getLeft()});
          return ImmutableList.of();
        }
        nestedSteps.put(childA.getRight(), pre);
      }
    }

    // A nested step may change the size of its child, which shifts the offsets of the children
    // after it. Going from the rightmost child leftwards keeps the remaining offsets valid.
    final List<Rearrangement> steps = new ArrayList<>();
    for (List<Rearrangement> pre : nestedSteps.descendingMap().values()) steps.addAll(pre);
    steps.add(new Rearrangement(position, format));
    LOG.log(Level.FINE, "rearrangement found at {0}: {1}", new Object[] {position, steps});
    return steps;
  }

  /** Prefers a candidate that is already structurally equal to `target`. */
  private static int pickCandidate(List<Integer> candidates, List<Pair<Expr, Integer>> children, Expr target) {
    for (int i = 0; i < candidates.size(); ++i) {
      if (children.get(candidates.get(i)).getLeft().equals(target)) return i;
    }
    return 0;
  }

  private static int argumentOffset(FunctionExpr func, int argIndex) {
    int offset = 1;
    for (int i = 0; i < argIndex; ++i) offset += func.args().get(i).size();
    return offset;
  }
}
