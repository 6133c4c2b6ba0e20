package eqlib.engine.expr;

import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static eqlib.common.utils.IterableSupport.all;
import static eqlib.common.utils.ListSupport.map;
import static eqlib.common.utils.ListSupport.replaced;
import static eqlib.engine.expr.ExprException.Kind.ADDRESS_NOT_FOUND;
import static eqlib.engine.expr.ExprException.Kind.MALFORMED_FORMAT;
import static eqlib.engine.expr.ExprException.Kind.NOT_REARRANGEABLE;

public abstract class ExprSupport {
  /** Format entry for a child of the target that has no counterpart among the source children. */
  public static final int FORMAT_GAP = -1;

  private ExprSupport() {}

  static void flattenTo(Expr expr, List<Expr> nodes) {
    nodes.add(expr);
    for (Expr arg : expr.args()) flattenTo(arg, nodes);
  }

  static List<Integer> search(Expr expr, Expr target) {
    final List<Integer> positions = new ArrayList<>();
    search0(expr, target, 0, positions);
    return positions;
  }

  private static void search0(Expr expr, Expr target, int offset, List<Integer> positions) {
    if (expr.size() < target.size()) return;
    if (expr.equals(target)) {
      positions.add(offset);
      return;
    }
    int argOffset = offset + 1;
    for (Expr arg : expr.args()) {
      search0(arg, target, argOffset, positions);
      argOffset += arg.size();
    }
  }

  static Expr at(Expr expr, int position) {
    checkPosition(expr, position);

    Expr node = expr;
    int remaining = position;
    while (remaining != 0) {
      --remaining;
      for (Expr arg : node.args()) {
        if (remaining < arg.size()) {
          node = arg;
          break;
        }
        remaining -= arg.size();
      }
    }
    return node;
  }

  static Expr replaceAt(Expr expr, int position, Expr replacement) {
    checkPosition(expr, position);
    return replaceAt0(expr, position, replacement);
  }

  private static Expr replaceAt0(Expr expr, int position, Expr replacement) {
    if (position == 0) return replacement;

    final List<Expr> args = expr.args();
    int remaining = position - 1;
    for (int i = 0, bound = args.size(); i < bound; ++i) {
      final Expr arg = args.get(i);
      if (remaining < arg.size()) {
        final Expr newArg = replaceAt0(arg, remaining, replacement);
        return ((FunctionExpr) expr).withArgs(replaced(args, i, newArg));
      }
      remaining -= arg.size();
    }

    throw new IllegalStateException("position " + position + " exceeds " + expr);
  }

  private static void checkPosition(Expr expr, int position) {
    if (position < 0 || position >= expr.size())
      throw new ExprException(ADDRESS_NOT_FOUND, "position not found: " + position);
  }

  static Set<Integer> functionIds(Expr expr) {
    final Set<Integer> ids = new HashSet<>();
    for (Expr node : expr.flatten()) {
      if (node instanceof FunctionExpr func) ids.add(func.id());
    }
    return ids;
  }

  /** Replaces every occurrence of `target` in `expr`. Replacements are not searched again. */
  public static Expr replaceAll(Expr expr, Expr target, Expr replacement) {
    if (expr.equals(target)) return replacement;
    if (expr.args().isEmpty() || expr.size() <= target.size()) return expr;

    final List<Expr> args = expr.args();
    final List<Expr> newArgs = map(args, arg -> replaceAll(arg, target, replacement));
    return newArgs.equals(args) ? expr : ((FunctionExpr) expr).withArgs(newArgs);
  }

  public static boolean isRearrangeable(Expr expr, Set<Integer> rearrangeableIds) {
    return expr instanceof FunctionExpr func
        && !func.isGeneric()
        && !func.isSymbol()
        && rearrangeableIds.contains(func.id());
  }

  /**
   * Children of a rearrangeable function application, paired with their offset relative to
   * `func`. Binary applications of the same operator are dissolved into their operands, so
   * `(a * b) * c` has the children `a, b, c`.
   *
   * <p>If `withGaps` is set, every dissolved application contributes a null entry after its
   * operands. The result then reads as a post-order program that rebuilds `func`.
   */
  public static List<Pair<Expr, Integer>> rearrangeableChildren(FunctionExpr func, boolean withGaps) {
    final List<Pair<Expr, Integer>> children = new ArrayList<>();
    collectChildren(func, func.id(), 0, withGaps, children);
    return children;
  }

  private static void collectChildren(
      Expr node, int opId, int offset, boolean withGaps, List<Pair<Expr, Integer>> children) {
    int argOffset = offset + 1;
    for (Expr arg : node.args()) {
      if (isAssociativeOperand(arg, opId)) {
        collectChildren(arg, opId, argOffset, withGaps, children);
        if (withGaps) children.add(null);
      } else {
        children.add(Pair.of(arg, argOffset));
      }
      argOffset += arg.size();
    }
  }

  private static boolean isAssociativeOperand(Expr arg, int opId) {
    return arg instanceof FunctionExpr func
        && !func.isGeneric()
        && func.id() == opId
        && func.args().size() == 2;
  }

  /**
   * Rebuilds the rearrangeable function at `position`. A non-negative format entry pushes the
   * child with that index (see {@link #rearrangeableChildren}), {@link #FORMAT_GAP} pops the two
   * topmost entries and pushes the operator applied to them. What is left on the stack becomes
   * the argument list.
   */
  static Expr rearrangeAt(Expr expr, List<Integer> format, int position, Set<Integer> rearrangeableIds) {
    final Expr node = at(expr, position);
    if (!isRearrangeable(node, rearrangeableIds))
      throw new ExprException(NOT_REARRANGEABLE, "given position is not a rearrangeable function");

    final FunctionExpr func = (FunctionExpr) node;
    final List<Expr> children = map(rearrangeableChildren(func, false), Pair::getLeft);
    final boolean[] used = new boolean[children.size()];
    final List<Expr> stack = new ArrayList<>(children.size());

    for (int index : format) {
      if (index == FORMAT_GAP) {
        if (stack.size() < 2) throw new ExprException(MALFORMED_FORMAT, "illegal value: " + index);
        final Expr right = stack.remove(stack.size() - 1);
        final Expr left = stack.remove(stack.size() - 1);
        stack.add(FunctionExpr.mk(func.id(), left, right));

      } else if (index < 0 || index >= children.size() || used[index]) {
        throw new ExprException(MALFORMED_FORMAT, "illegal value: " + index);

      } else {
        used[index] = true;
        stack.add(children.get(index));
      }
    }

    for (boolean u : used) if (!u) throw new ExprException(MALFORMED_FORMAT, "malformed format");
    if (stack.size() < 2) throw new ExprException(MALFORMED_FORMAT, "malformed format");

    return replaceAt(expr, position, func.withArgs(stack));
  }

  static Expr evaluate(Expr expr, ExprContext ctx) {
    if (!(expr instanceof FunctionExpr func)) return expr;

    final List<Expr> args = map(func.args(), arg -> evaluate(arg, ctx));
    if (!func.isGeneric() && ctx.canCompute(func.id()) && all(args, Expr::isNumber)) {
      final double[] values = new double[args.size()];
      for (int i = 0; i < values.length; ++i) values[i] = ((NumberExpr) args.get(i)).value();
      final double value = ctx.compute(func.id(), values);
      // undefined results such as 0/0 stay symbolic
      if (!Double.isNaN(value)) return NumberExpr.mk(value);
    }

    return args.equals(func.args()) ? func : func.withArgs(args);
  }
}
