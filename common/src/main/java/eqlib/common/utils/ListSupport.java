package eqlib.common.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

public interface ListSupport {
  static <X, Y> List<Y> map(List<? extends X> xs, Function<? super X, ? extends Y> func) {
    final List<Y> ys = new ArrayList<>(xs.size());
    for (X x : xs) ys.add(func.apply(x));
    return ys;
  }

  /** Returns a copy of `xs` with the element at `idx` replaced by `x`. */
  static <X> List<X> replaced(List<X> xs, int idx, X x) {
    final List<X> ys = new ArrayList<>(xs);
    ys.set(idx, x);
    return ys;
  }

  /** Indices at which `xs` and `ys` hold unequal elements. Both lists must be equally long. */
  static <X> List<Integer> differentIndices(List<? extends X> xs, List<? extends X> ys) {
    if (xs.size() != ys.size()) throw new IllegalArgumentException("lists differ in length");
    final List<Integer> indices = new ArrayList<>();
    for (int i = 0, bound = xs.size(); i < bound; ++i) {
      if (!xs.get(i).equals(ys.get(i))) indices.add(i);
    }
    return indices.isEmpty() ? Collections.emptyList() : indices;
  }
}
