package com.gentoro.duosmium.results.loader;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.duosmium.Fixtures;
import com.gentoro.duosmium.exception.ParseException;
import com.gentoro.duosmium.results.model.LoadedRecord;
import com.gentoro.duosmium.results.model.PlacingRecord;
import com.gentoro.duosmium.results.model.Team;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RecordLoaderTest {

  private final RecordLoader loader = new RecordLoader();

  private static final String MINIMAL =
      """
      Tournament:
        level: Invitational
        location: Somewhere
      Events:
        - name: Anatomy
      Teams:
        - number: 1
          school: Alpha
      Placings:
        - event: Anatomy
          team: 1
          place: 1
      """;

  @Test
  @DisplayName("Loads every section of a fixture record into typed entities")
  void loadsFixture() {
    LoadedRecord record =
        loader.load(Fixtures.TROY, Fixtures.store().read(Fixtures.TROY));

    assertEquals(Fixtures.TROY, record.tournament().id());
    assertEquals("Troy Invitational", record.tournament().name().orElseThrow());
    assertEquals(1, record.tournament().droppedPlacings());
    assertEquals(4, record.events().size());
    assertTrue(record.events().get(3).trial());
    assertEquals(5, record.teams().size());
    assertEquals(20, record.placings().size());
    assertEquals(1, record.penalties().size());

    Team exhibition = record.teams().get(3);
    assertTrue(exhibition.exhibition());
    assertFalse(exhibition.official());
    assertEquals("Los Angeles, CA", exhibition.location());
    assertTrue(record.raw().has("Placings"));
  }

  @Test
  @DisplayName("Flow-style placings with flags keep their defaults")
  void placingDefaults() {
    LoadedRecord record =
        loader.load(Fixtures.TROY, Fixtures.store().read(Fixtures.TROY));
    PlacingRecord dq =
        record.placings().stream()
            .filter(p -> p.teamNumber() == 12 && p.eventName().equals("Forensics"))
            .findFirst()
            .orElseThrow();
    assertTrue(dq.disqualified());
    assertTrue(dq.participated());
    assertNull(dq.place());

    PlacingRecord noShow =
        record.placings().stream()
            .filter(p -> p.teamNumber() == 11 && p.eventName().equals("Fermi Questions"))
            .findFirst()
            .orElseThrow();
    assertFalse(noShow.participated());
  }

  @Test
  @DisplayName("Raw scores and scoring direction are read")
  void rawScores() {
    LoadedRecord record =
        loader.load(Fixtures.NATIONALS, Fixtures.store().read(Fixtures.NATIONALS));
    assertFalse(record.events().get(0).lowestWins());
    assertTrue(record.events().get(1).lowestWins());
    assertEquals(88.5, record.placings().get(0).rawScore().doubleValue());
    assertEquals(60, record.tournament().maximumPlace().orElseThrow());
  }

  @Test
  @DisplayName("Missing sections are reported by name")
  void missingSection() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () -> loader.load("x", MINIMAL.replace("Teams:", "Squads:")));
    assertTrue(e.getMessage().startsWith("Teams:"), e.getMessage());
  }

  @Test
  @DisplayName("Field errors carry the path of the offending entry")
  void fieldPath() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () -> loader.load("x", MINIMAL.replace("number: 1", "number: one")));
    assertEquals("Teams[0].number: expected an integer", e.getMessage());

    e =
        assertThrows(
            ParseException.class, () -> loader.load("x", MINIMAL.replace("school: Alpha", "")));
    assertEquals("Teams[0].school: missing", e.getMessage());
  }

  @Test
  @DisplayName("Duplicate team numbers, event names and placing pairs are rejected")
  void duplicates() {
    String duplicateTeam =
        MINIMAL.replace(
            "    school: Alpha\n", "    school: Alpha\n  - number: 1\n    school: Beta\n");
    assertThrows(ParseException.class, () -> loader.load("x", duplicateTeam));

    String duplicateEvent =
        MINIMAL.replace("  - name: Anatomy\n", "  - name: Anatomy\n  - name: Anatomy\n");
    assertThrows(ParseException.class, () -> loader.load("x", duplicateEvent));

    String duplicatePlacing =
        MINIMAL + "  - event: Anatomy\n    team: 1\n    place: 2\n";
    ParseException e = assertThrows(ParseException.class, () -> loader.load("x", duplicatePlacing));
    assertTrue(e.getMessage().contains("duplicate placing"), e.getMessage());
  }

  @Test
  @DisplayName("A participating placing needs a place or a raw score")
  void placeOrScoreRequired() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () -> loader.load("x", MINIMAL.replace("    place: 1\n", "")));
    assertEquals("Placings[0]: missing place or raw score", e.getMessage());
  }

  @Test
  @DisplayName("Negative places and malformed YAML are parse errors")
  void invalidValues() {
    assertThrows(
        ParseException.class, () -> loader.load("x", MINIMAL.replace("place: 1", "place: -1")));
    assertThrows(ParseException.class, () -> loader.load("x", "Tournament: [unclosed"));
    assertThrows(ParseException.class, () -> loader.load("x", "- just\n- a list\n"));
  }
}
