package com.gentoro.duosmium.search;

import static org.junit.jupiter.api.Assertions.*;

import java.util.OptionalDouble;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FuzzyMatcherTest {

  private final FuzzyMatcher matcher = new FuzzyMatcher(0.4, 2, 1);

  @Test
  @DisplayName("Substring edit distance is normalized by the query length")
  void distance() {
    assertEquals(0.0, FuzzyMatcher.distance("county", "orange county regional"));
    assertEquals(1, FuzzyMatcher.bestSubstringEdits("countz", "orange county regional"));
    assertEquals(1.0 / 13, FuzzyMatcher.distance("orange countz", "orange county regional"), 1e-9);
    assertEquals(1.0, FuzzyMatcher.distance("abc", ""));
    assertEquals(0.0, FuzzyMatcher.distance("", "anything"));
  }

  @Test
  @DisplayName("Matching on both keys scores better than on the text alone")
  void weighting() {
    OptionalDouble both = matcher.score("orange", "orange county", "orange county 1989");
    OptionalDouble textOnly = matcher.score("orange", "irvine middle school", "orange county 1989");
    assertTrue(both.isPresent());
    assertTrue(textOnly.isPresent());
    assertTrue(both.getAsDouble() < textOnly.getAsDouble());
  }

  @Test
  @DisplayName("Entries beyond the threshold on every key are discarded")
  void threshold() {
    assertTrue(matcher.score("cornell", "troy invitational", "troy high school").isEmpty());
    assertTrue(matcher.score("", "a", "b").isEmpty());
  }

  @Test
  @DisplayName("Invalid thresholds and weights are rejected")
  void validation() {
    assertThrows(IllegalArgumentException.class, () -> new FuzzyMatcher(1.5, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> new FuzzyMatcher(0.4, 0, 1));
  }
}
