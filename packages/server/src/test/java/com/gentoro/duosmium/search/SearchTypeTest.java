package com.gentoro.duosmium.search;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.duosmium.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SearchTypeTest {

  @Test
  @DisplayName("Accepts the documented values, plurals and aliases")
  void parse() {
    assertEquals(SearchType.BOTH, SearchType.parse(null));
    assertEquals(SearchType.BOTH, SearchType.parse(""));
    assertEquals(SearchType.BOTH, SearchType.parse("all"));
    assertEquals(SearchType.TOURNAMENT, SearchType.parse("Tournaments"));
    assertEquals(SearchType.TEAM, SearchType.parse("team"));
    assertEquals(SearchType.TEAM, SearchType.parse("schools"));
  }

  @Test
  @DisplayName("Rejects unknown types")
  void invalid() {
    assertThrows(ValidationException.class, () -> SearchType.parse("events"));
  }

  @Test
  @DisplayName("Kinds included by each type")
  void includes() {
    assertTrue(SearchType.BOTH.includesTeams() && SearchType.BOTH.includesTournaments());
    assertFalse(SearchType.TEAM.includesTournaments());
    assertFalse(SearchType.TOURNAMENT.includesTeams());
  }
}
