package com.gentoro.duosmium.results.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Typed entities of one results record, as produced by the loader. Lists keep record order.
 *
 * @param raw the parsed document tree, kept for verbatim export
 */
public record LoadedRecord(
    Tournament tournament,
    List<Event> events,
    List<Team> teams,
    List<PlacingRecord> placings,
    List<PenaltyRecord> penalties,
    JsonNode raw) {

  public LoadedRecord {
    events = List.copyOf(events);
    teams = List.copyOf(teams);
    placings = List.copyOf(placings);
    penalties = List.copyOf(penalties);
  }
}
