package eqlib.engine.diff;

import com.google.common.collect.ImmutableList;
import eqlib.engine.expr.Expr;
import eqlib.engine.expr.ExprSupport;

import java.util.List;
import java.util.Set;

/**
 * Reordering of the rearrangeable function at `position`. See {@link Expr#rearrangeAt} for the
 * meaning of `format`.
 */
public record Rearrangement(int position, List<Integer> format) {
  public Rearrangement {
    format = ImmutableList.copyOf(format);
  }

  public Expr apply(Expr expr, Set<Integer> rearrangeableIds) {
    return expr.rearrangeAt(format, position, rearrangeableIds);
  }

  /** Applies the steps in order. */
  public static Expr applyAll(Expr expr, List<Rearrangement> steps, Set<Integer> rearrangeableIds) {
    for (Rearrangement step : steps) expr = step.apply(expr, rearrangeableIds);
    return expr;
  }

  public boolean hasGaps() {
    return format.contains(ExprSupport.FORMAT_GAP);
  }
}
