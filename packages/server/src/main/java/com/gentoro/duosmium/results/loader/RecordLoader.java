package com.gentoro.duosmium.results.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.duosmium.exception.ParseException;
import com.gentoro.duosmium.exception.SerializationException;
import com.gentoro.duosmium.results.model.Event;
import com.gentoro.duosmium.results.model.LoadedRecord;
import com.gentoro.duosmium.results.model.PenaltyRecord;
import com.gentoro.duosmium.results.model.PlacingRecord;
import com.gentoro.duosmium.results.model.Team;
import com.gentoro.duosmium.results.model.Tournament;
import com.gentoro.duosmium.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a SciolyFF results document into typed entities.
 *
 * <p>The loader checks structure only: required fields, value types and uniqueness of team
 * numbers, event names and (team, event) pairs. Cross references between sections are left to the
 * interpreter. Every failure is a {@link ParseException} whose message starts with the path of the
 * offending field, e.g. {@code Teams[3].number: expected an integer}.
 */
public class RecordLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(RecordLoader.class);

  /** Parse YAML text and load it. */
  public LoadedRecord load(String id, String yaml) {
    JsonNode root;
    try {
      root = JacksonUtility.readYamlTree(yaml);
    } catch (SerializationException e) {
      throw new ParseException("Record '%s' is not valid YAML".formatted(id), e);
    }
    return load(id, root);
  }

  public LoadedRecord load(String id, JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new ParseException("$", "record must be a mapping");
    }
    Tournament tournament = loadTournament(id, section(root, "Tournament", true));
    List<Event> events = loadEvents(list(root, "Events", true));
    List<Team> teams = loadTeams(list(root, "Teams", true));
    List<PlacingRecord> placings = loadPlacings(list(root, "Placings", true));
    List<PenaltyRecord> penalties = loadPenalties(list(root, "Penalties", false));

    log.debug(
        "Loaded record {}: {} events, {} teams, {} placings, {} penalties",
        id,
        events.size(),
        teams.size(),
        placings.size(),
        penalties.size());
    return new LoadedRecord(tournament, events, teams, placings, penalties, root);
  }

  private Tournament loadTournament(String id, JsonNode node) {
    String path = "Tournament";
    int dropped = intValue(node, "worst placings dropped", path, 0);
    if (dropped < 0) {
      throw new ParseException(path + ".worst placings dropped", "must not be negative");
    }
    Integer maximumPlace = optionalInt(node, "maximum place", path);
    if (maximumPlace != null && maximumPlace <= 0) {
      throw new ParseException(path + ".maximum place", "must be positive");
    }
    return Tournament.builder(id)
        .name(text(node, "name", path))
        .shortName(text(node, "short name", path))
        .level(text(node, "level", path))
        .location(text(node, "location", path))
        .state(text(node, "state", path))
        .division(text(node, "division", path))
        .year(optionalInt(node, "year", path))
        .date(text(node, "date", path))
        .droppedPlacings(dropped)
        .maximumPlace(maximumPlace)
        .build();
  }

  private List<Event> loadEvents(JsonNode list) {
    List<Event> events = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (int i = 0; i < list.size(); i++) {
      String path = "Events[%d]".formatted(i);
      JsonNode node = entry(list, i, path);
      String name = requiredText(node, "name", path);
      if (!names.add(name)) {
        throw new ParseException(path + ".name", "duplicate event '%s'".formatted(name));
      }
      String scoring = text(node, "scoring", path);
      if (scoring != null && !scoring.equals("highest") && !scoring.equals("lowest")) {
        throw new ParseException(path + ".scoring", "expected 'highest' or 'lowest'");
      }
      events.add(
          new Event(
              name,
              bool(node, "trial", path, false),
              bool(node, "trialed", path, false),
              "lowest".equals(scoring)));
    }
    return events;
  }

  private List<Team> loadTeams(JsonNode list) {
    List<Team> teams = new ArrayList<>();
    Set<Integer> numbers = new HashSet<>();
    for (int i = 0; i < list.size(); i++) {
      String path = "Teams[%d]".formatted(i);
      JsonNode node = entry(list, i, path);
      int number = requiredInt(node, "number", path);
      if (!numbers.add(number)) {
        throw new ParseException(path + ".number", "duplicate team number %d".formatted(number));
      }
      teams.add(
          new Team(
              number,
              requiredText(node, "school", path),
              text(node, "school abbreviation", path),
              text(node, "suffix", path),
              text(node, "subdivision", path),
              text(node, "city", path),
              text(node, "state", path),
              bool(node, "disqualified", path, false),
              bool(node, "exhibition", path, false)));
    }
    return teams;
  }

  private List<PlacingRecord> loadPlacings(JsonNode list) {
    List<PlacingRecord> placings = new ArrayList<>();
    Set<String> pairs = new HashSet<>();
    for (int i = 0; i < list.size(); i++) {
      String path = "Placings[%d]".formatted(i);
      JsonNode node = entry(list, i, path);
      String event = requiredText(node, "event", path);
      int team = requiredInt(node, "team", path);
      if (!pairs.add(team + "\u0000" + event)) {
        throw new ParseException(
            path, "duplicate placing for team %d in event '%s'".formatted(team, event));
      }
      Integer place = optionalInt(node, "place", path);
      if (place != null && place < 0) {
        throw new ParseException(path + ".place", "must not be negative");
      }
      Double raw = rawScore(node, path);
      boolean participated = bool(node, "participated", path, true);
      boolean disqualified = bool(node, "disqualified", path, false);
      if (participated && !disqualified && place == null && raw == null) {
        throw new ParseException(path, "missing place or raw score");
      }
      placings.add(new PlacingRecord(event, team, place, raw, participated, disqualified));
    }
    return placings;
  }

  private List<PenaltyRecord> loadPenalties(JsonNode list) {
    List<PenaltyRecord> penalties = new ArrayList<>();
    for (int i = 0; i < list.size(); i++) {
      String path = "Penalties[%d]".formatted(i);
      JsonNode node = entry(list, i, path);
      int points = requiredInt(node, "points", path);
      if (points < 0) {
        throw new ParseException(path + ".points", "must not be negative");
      }
      penalties.add(new PenaltyRecord(requiredInt(node, "team", path), points));
    }
    return penalties;
  }

  private static Double rawScore(JsonNode node, String path) {
    JsonNode raw = node.get("raw");
    if (raw == null || raw.isNull()) return null;
    if (!raw.isObject()) {
      throw new ParseException(path + ".raw", "expected a mapping");
    }
    JsonNode score = raw.get("score");
    if (score == null || score.isNull()) {
      throw new ParseException(path + ".raw.score", "missing");
    }
    if (!score.isNumber()) {
      throw new ParseException(path + ".raw.score", "expected a number");
    }
    return score.doubleValue();
  }

  private static JsonNode section(JsonNode root, String name, boolean required) {
    JsonNode node = root.get(name);
    if (node == null || node.isNull()) {
      if (required) throw new ParseException(name, "missing section");
      return null;
    }
    if (!node.isObject()) {
      throw new ParseException(name, "expected a mapping");
    }
    return node;
  }

  private static JsonNode list(JsonNode root, String name, boolean required) {
    JsonNode node = root.get(name);
    if (node == null || node.isNull()) {
      if (required) throw new ParseException(name, "missing section");
      return JacksonUtility.getJsonMapper().createArrayNode();
    }
    if (!node.isArray()) {
      throw new ParseException(name, "expected a list");
    }
    return node;
  }

  private static JsonNode entry(JsonNode list, int index, String path) {
    JsonNode node = list.get(index);
    if (node == null || !node.isObject()) {
      throw new ParseException(path, "expected a mapping");
    }
    return node;
  }

  private static String text(JsonNode node, String field, String path) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) return null;
    if (value.isContainerNode()) {
      throw new ParseException(path + "." + field, "expected a scalar value");
    }
    return value.asText();
  }

  private static String requiredText(JsonNode node, String field, String path) {
    String value = text(node, field, path);
    if (value == null || value.isBlank()) {
      throw new ParseException(path + "." + field, "missing");
    }
    return value;
  }

  private static Integer optionalInt(JsonNode node, String field, String path) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) return null;
    if (value.isIntegralNumber() && value.canConvertToInt()) return value.intValue();
    if (value.isTextual()) {
      try {
        return Integer.parseInt(value.textValue().trim());
      } catch (NumberFormatException ignored) {
        // reported below
      }
    }
    throw new ParseException(path + "." + field, "expected an integer");
  }

  private static int intValue(JsonNode node, String field, String path, int defaultValue) {
    Integer value = optionalInt(node, field, path);
    return value == null ? defaultValue : value;
  }

  private static int requiredInt(JsonNode node, String field, String path) {
    Integer value = optionalInt(node, field, path);
    if (value == null) {
      throw new ParseException(path + "." + field, "missing");
    }
    return value;
  }

  private static boolean bool(JsonNode node, String field, String path, boolean defaultValue) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) return defaultValue;
    if (!value.isBoolean()) {
      throw new ParseException(path + "." + field, "expected true or false");
    }
    return value.booleanValue();
  }
}
