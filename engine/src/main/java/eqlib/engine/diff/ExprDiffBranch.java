package eqlib.engine.diff;

import com.google.common.collect.ImmutableList;
import eqlib.engine.expr.Rule;

import java.util.List;
import java.util.Objects;

/** One node of the difference between two expressions. */
public final class ExprDiffBranch {
  private final int position;
  private final boolean different;
  private final Rule replaced;
  private final ImmutableList<Rearrangement> rearrangements;
  private final ImmutableList<ExprDiffBranch> argumentDifference;

  private ExprDiffBranch(
      int position,
      boolean different,
      Rule replaced,
      List<Rearrangement> rearrangements,
      List<ExprDiffBranch> argumentDifference) {
    this.position = position;
    this.different = different;
    this.replaced = replaced;
    this.rearrangements = ImmutableList.copyOf(rearrangements);
    this.argumentDifference = ImmutableList.copyOf(argumentDifference);
  }

  public static ExprDiffBranch same(int position) {
    return new ExprDiffBranch(position, false, null, ImmutableList.of(), ImmutableList.of());
  }

  public static ExprDiffBranch replace(int position, Rule replaced) {
    return new ExprDiffBranch(position, true, replaced, ImmutableList.of(), ImmutableList.of());
  }

  public ExprDiffBranch withRearrangements(List<Rearrangement> rearrangements) {
    return new ExprDiffBranch(position, different, replaced, rearrangements, argumentDifference);
  }

  public ExprDiffBranch withArgumentDifference(List<ExprDiffBranch> argumentDifference) {
    return new ExprDiffBranch(position, different, replaced, rearrangements, argumentDifference);
  }

  /** Pre-order position in the expression the diff was computed on. */
  public int position() {
    return position;
  }

  public boolean different() {
    return different;
  }

  /** Substitution resolving this branch as a whole. Null if the branch is not different. */
  public Rule replaced() {
    return replaced;
  }

  /** Empty unless the branch is resolved by reordering. */
  public List<Rearrangement> rearrangements() {
    return rearrangements;
  }

  /** Per-argument differences, if both sides apply the same function. */
  public List<ExprDiffBranch> argumentDifference() {
    return argumentDifference;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ExprDiffBranch that)) return false;
    return position == that.position
        && different == that.different
        && Objects.equals(replaced, that.replaced)
        && rearrangements.equals(that.rearrangements)
        && argumentDifference.equals(that.argumentDifference);
  }

  @Override
  public int hashCode() {
    return Objects.hash(position, different, replaced, rearrangements, argumentDifference);
  }

  @Override
  public String toString() {
    if (!different) return "Same@" + position;
    final StringBuilder builder = new StringBuilder("Diff@").append(position).append('{').append(replaced);
    if (!rearrangements.isEmpty()) builder.append(", rearrange ").append(rearrangements);
    if (!argumentDifference.isEmpty()) builder.append(", args ").append(argumentDifference);
    return builder.append('}').toString();
  }
}
