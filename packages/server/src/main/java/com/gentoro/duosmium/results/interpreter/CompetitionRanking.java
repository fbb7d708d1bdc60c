package com.gentoro.duosmium.results.interpreter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Standard competition ranking ("1224"): equal keys share a rank, and the rank after a tie group
 * is the previous rank plus the size of the group. Lower keys rank first.
 */
public final class CompetitionRanking {

  private CompetitionRanking() {}

  /** An item with its rank and whether it shares that rank with another item. */
  public record Ranked<T>(T item, int rank, boolean tie) {}

  /** Rank where an outsider would land against a pool, without taking a slot in it. */
  public record Isolated(int rank, boolean tie) {}

  /**
   * Ranks items by key. Items with equal keys keep their input order, so the result is
   * deterministic for a given input list.
   */
  public static <T> List<Ranked<T>> rank(List<T> items, ToDoubleFunction<T> key) {
    List<T> sorted = new ArrayList<>(items);
    sorted.sort(Comparator.comparingDouble(key));

    List<Ranked<T>> result = new ArrayList<>(sorted.size());
    int i = 0;
    while (i < sorted.size()) {
      double k = key.applyAsDouble(sorted.get(i));
      int j = i;
      while (j < sorted.size() && Double.compare(key.applyAsDouble(sorted.get(j)), k) == 0) {
        j++;
      }
      int groupSize = j - i;
      for (int g = i; g < j; g++) {
        result.add(new Ranked<>(sorted.get(g), i + 1, groupSize > 1));
      }
      i = j;
    }
    return result;
  }

  /**
   * Rank of {@code key} against {@code poolKeys}: one plus the number of strictly better pool keys.
   * The tie flag is set when a pool key is equal.
   */
  public static Isolated isolated(double key, double[] poolKeys) {
    int better = 0;
    boolean tie = false;
    for (double k : poolKeys) {
      int cmp = Double.compare(k, key);
      if (cmp < 0) better++;
      else if (cmp == 0) tie = true;
    }
    return new Isolated(better + 1, tie);
  }

  static double[] keys(List<Double> values) {
    double[] out = values.stream().mapToDouble(Double::doubleValue).toArray();
    Arrays.sort(out);
    return out;
  }
}
