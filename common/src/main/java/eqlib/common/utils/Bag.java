package eqlib.common.utils;

import java.util.HashMap;
import java.util.Map;

/** A multiset. Elements with a zero count are not stored. */
public class Bag<T> {

  private final Map<T, Integer> countMap;

  public Bag() {
    countMap = new HashMap<>();
  }

  public static <T> Bag<T> of(Iterable<? extends T> elements) {
    final Bag<T> bag = new Bag<>();
    for (T e : elements) bag.add(e);
    return bag;
  }

  public void add(T e, int count) {
    if (count <= 0) return;
    countMap.merge(e, count, Integer::sum);
  }

  public void add(T e) {
    add(e, 1);
  }

  /** Removes one occurrence. Returns false if `e` is absent. */
  public boolean remove(T e) {
    final Integer count = countMap.get(e);
    if (count == null) return false;
    if (count == 1) countMap.remove(e);
    else countMap.put(e, count - 1);
    return true;
  }

  public int count(T e) {
    return countMap.getOrDefault(e, 0);
  }

  public int size() {
    return countMap.values().stream().mapToInt(Integer::intValue).sum();
  }

  public boolean isEmpty() {
    return countMap.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Bag<?> that)) return false;
    return countMap.equals(that.countMap);
  }

  @Override
  public int hashCode() {
    return countMap.hashCode();
  }

  @Override
  public String toString() {
    return countMap.toString();
  }
}
