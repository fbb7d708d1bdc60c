package com.gentoro.duosmium.results.query;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.duosmium.exception.NotFoundException;
import com.gentoro.duosmium.results.model.Team;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TeamResolverTest {

  private static Team team(int number, String school, String suffix) {
    return new Team(number, school, null, suffix, null, null, null, false, false);
  }

  private final TeamResolver resolver =
      new TeamResolver(
          List.of(
              team(1, "Troy High School", null),
              team(2, "Troy", "Blue"),
              team(3, "Arcadia High School", null),
              team(4, "Lakeside Middle School", "A"),
              team(5, "Lakeside Middle School", "B"),
              team(42, "Mira Loma High School", null)));

  @Test
  @DisplayName("Numeric references resolve by team number first")
  void byNumber() {
    assertEquals(42, resolver.resolve("42").number());
    assertEquals(3, resolver.resolve("#3").number());
    assertEquals(3, resolver.resolve(" 3 ").number());
  }

  @Test
  @DisplayName("Exact school names beat prefix and substring matches")
  void tiers() {
    // "Troy" is an exact match for team 2 and only a prefix of team 1
    assertEquals(2, resolver.resolve("troy").number());
    assertEquals(1, resolver.resolve("Troy High").number());
    assertEquals(3, resolver.resolve("arcadia").number());
    assertEquals(42, resolver.resolve("loma").number());
  }

  @Test
  @DisplayName("Suffixes disambiguate teams of the same school, record order breaks ties")
  void suffixes() {
    assertEquals(5, resolver.resolve("Lakeside Middle School B").number());
    assertEquals(4, resolver.resolve("Lakeside").number());
    assertEquals(1, resolver.resolve("high school").number());
  }

  @Test
  @DisplayName("Unknown numbers fall through to name matching and then fail")
  void notFound() {
    NotFoundException e = assertThrows(NotFoundException.class, () -> resolver.resolve("99"));
    assertEquals(NotFoundException.EntityKind.TEAM, e.getKind());
    assertTrue(resolver.find("Nowhere Academy").isEmpty());
    assertTrue(resolver.find("  ").isEmpty());
    assertTrue(resolver.find(null).isEmpty());
  }
}
