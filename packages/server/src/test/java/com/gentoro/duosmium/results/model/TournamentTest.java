package com.gentoro.duosmium.results.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TournamentTest {

  @Test
  @DisplayName("An explicit name wins over the derived title")
  void explicitName() {
    Tournament t =
        Tournament.builder("x").name("Golden Gate Invitational").level("Invitational").build();
    assertEquals("Golden Gate Invitational", t.displayTitle());
  }

  @Test
  @DisplayName("Titles are derived from level, state and location")
  void derivedTitles() {
    assertEquals(
        "Science Olympiad National Tournament",
        Tournament.builder("n").level("Nationals").location("Cornell").build().displayTitle());
    assertEquals(
        "SoCal Science Olympiad State Tournament",
        Tournament.builder("s").level("States").state("sCA").build().displayTitle());
    assertEquals(
        "NorCal Science Olympiad State Tournament",
        Tournament.builder("s").level("States").state("nCA").build().displayTitle());
    assertEquals(
        "Ohio Science Olympiad State Tournament",
        Tournament.builder("s").level("States").state("Ohio").build().displayTitle());
    assertEquals(
        "Orange County Regional Tournament",
        Tournament.builder("r")
            .level("Regionals")
            .location("Orange County")
            .build()
            .displayTitle());
    assertEquals(
        "MIT Invitational",
        Tournament.builder("i").level("Invitational").location("MIT").build().displayTitle());
  }

  @Test
  @DisplayName("Unknown levels keep their label and fall back to the id")
  void unknownLevel() {
    Tournament t = Tournament.builder("2020-01-01_mystery").level("Scrimmage").build();
    assertTrue(t.title().isEmpty());
    assertTrue(t.level().isEmpty());
    assertEquals("Scrimmage", t.levelLabel());
    assertEquals("2020-01-01_mystery", t.displayTitle());
  }

  @Test
  @DisplayName("Team location and display name skip missing parts")
  void teamLabels() {
    Team full =
        new Team(1, "Troy High School", null, "Blue", null, "Fullerton", "CA", false, false);
    assertEquals("Fullerton, CA", full.location());
    assertEquals("Troy High School Blue", full.displayName());

    Team bare = new Team(2, "Solo", null, null, null, null, " ", false, true);
    assertEquals("", bare.location());
    assertEquals("Solo", bare.displayName());
    assertFalse(bare.official());
  }
}
