package com.gentoro.duosmium.search;

import java.util.OptionalDouble;

/**
 * Weighted approximate matching of a query against the two keys of a {@link SearchEntry}.
 *
 * <p>Per key, the distance is the smallest edit distance between the query and any substring of
 * the key, divided by the query length: 0 for an exact occurrence, 1 for nothing in common. A key
 * matches when its distance is at most the threshold. Matching keys are combined as
 * {@code prod(distance ^ (weight / totalWeight))}, with an exact match counted as {@value
 * #EXACT_SCORE}, so an entry matching on both keys beats one matching on the text alone.
 */
public class FuzzyMatcher {
  static final double EXACT_SCORE = 0.001;

  private final double threshold;
  private final double nameWeight;
  private final double textWeight;

  public FuzzyMatcher(double threshold, double nameWeight, double textWeight) {
    if (threshold < 0 || threshold > 1) {
      throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
    }
    if (nameWeight <= 0 || textWeight <= 0) {
      throw new IllegalArgumentException("weights must be positive");
    }
    this.threshold = threshold;
    this.nameWeight = nameWeight;
    this.textWeight = textWeight;
  }

  /**
   * Combined score of a normalized query against normalized keys; empty when neither key matches.
   */
  public OptionalDouble score(String query, String name, String text) {
    if (query == null || query.isEmpty()) return OptionalDouble.empty();
    double total = nameWeight + textWeight;
    double combined = 1.0;
    boolean matched = false;

    double nameDistance = distance(query, name);
    if (nameDistance <= threshold) {
      combined *= Math.pow(Math.max(nameDistance, EXACT_SCORE), nameWeight / total);
      matched = true;
    }
    double textDistance = distance(query, text);
    if (textDistance <= threshold) {
      combined *= Math.pow(Math.max(textDistance, EXACT_SCORE), textWeight / total);
      matched = true;
    }
    return matched ? OptionalDouble.of(combined) : OptionalDouble.empty();
  }

  /** Normalized approximate-substring edit distance in [0, 1]. */
  static double distance(String pattern, String text) {
    if (pattern.isEmpty()) return 0;
    if (text == null || text.isEmpty()) return 1;
    if (text.contains(pattern)) return 0;
    return (double) bestSubstringEdits(pattern, text) / pattern.length();
  }

  /**
   * Minimum edits turning {@code pattern} into some substring of {@code text}. The first row is
   * all zeros so a match may start anywhere in the text.
   */
  static int bestSubstringEdits(String pattern, String text) {
    int m = pattern.length();
    int n = text.length();
    int[] prev = new int[n + 1];
    int[] cur = new int[n + 1];
    for (int i = 1; i <= m; i++) {
      cur[0] = i;
      char pc = pattern.charAt(i - 1);
      for (int j = 1; j <= n; j++) {
        int cost = pc == text.charAt(j - 1) ? 0 : 1;
        cur[j] = Math.min(Math.min(prev[j] + 1, cur[j - 1] + 1), prev[j - 1] + cost);
      }
      int[] swap = prev;
      prev = cur;
      cur = swap;
    }
    int best = m;
    for (int j = 0; j <= n; j++) {
      best = Math.min(best, prev[j]);
    }
    return best;
  }
}
