package edu.jhu.hlt.ptb.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Occurrence counts. Ties in {@link #getKeysSortedByCount} keep first-seen
 * order, so output is stable from run to run.
 */
public class Counts<T> {
  private final Map<T, Integer> counts = new LinkedHashMap<>();
  private int total = 0;

  public int getCount(T t) {
    Integer c = counts.get(t);
    return c == null ? 0 : c;
  }

  public double getProportion(T t) {
    if (total == 0)
      return 0d;
    return ((double) getCount(t)) / total;
  }

  public int increment(T t) {
    return update(t, 1);
  }

  public void incrementAll(Iterable<? extends T> items) {
    for (T t : items)
      increment(t);
  }

  /** @return the count before the update */
  public int update(T t, int delta) {
    int c = getCount(t);
    if (c + delta < 0)
      throw new IllegalArgumentException("count would go negative for " + t + ": " + c + " + " + delta);
    counts.put(t, c + delta);
    total += delta;
    return c;
  }

  public int numNonZero() {
    int n = 0;
    for (int c : counts.values())
      if (c > 0) n++;
    return n;
  }

  public int getTotalCount() {
    return total;
  }

  public List<T> getKeysSortedByCount(final boolean descending) {
    List<T> items = new ArrayList<>(counts.keySet());
    Comparator<T> byCount = Comparator.comparingInt(this::getCount);
    Collections.sort(items, descending ? byCount.reversed() : byCount);
    return items;
  }

  @Override
  public String toString() {
    return counts.toString();
  }
}
