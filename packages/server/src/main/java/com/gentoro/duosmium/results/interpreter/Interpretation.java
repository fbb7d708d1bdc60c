package com.gentoro.duosmium.results.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.duosmium.results.model.Event;
import com.gentoro.duosmium.results.model.Placement;
import com.gentoro.duosmium.results.model.Team;
import com.gentoro.duosmium.results.model.TeamStanding;
import com.gentoro.duosmium.results.model.Tournament;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fully derived state of one tournament. Immutable; safe to share between threads.
 *
 * <p>Instances only come out of {@link Interpreter#interpret}, which either derives everything or
 * throws.
 */
public final class Interpretation {
  private final Tournament tournament;
  private final List<Event> events;
  private final List<Team> teams;
  private final List<Placement> placements;
  private final Map<Integer, TeamStanding> standings;
  private final List<TeamStanding> ranked;
  private final JsonNode raw;

  Interpretation(
      Tournament tournament,
      List<Event> events,
      List<Team> teams,
      List<Placement> placements,
      Map<Integer, TeamStanding> standings,
      JsonNode raw) {
    this.tournament = tournament;
    this.events = List.copyOf(events);
    this.teams = List.copyOf(teams);
    this.placements = List.copyOf(placements);
    this.standings = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(standings));
    this.ranked =
        standings.values().stream()
            .sorted(
                Comparator.comparingInt(TeamStanding::rank)
                    .thenComparing(s -> !s.official())
                    .thenComparingInt(s -> s.team().number()))
            .collect(Collectors.toUnmodifiableList());
    this.raw = raw;
  }

  public Tournament tournament() {
    return tournament;
  }

  /** Events in record order. */
  public List<Event> events() {
    return events;
  }

  /** Teams in record order. */
  public List<Team> teams() {
    return teams;
  }

  public List<Placement> placements() {
    return placements;
  }

  /** Standings ordered by rank, official teams before non-official ones at the same rank. */
  public List<TeamStanding> rankedStandings() {
    return ranked;
  }

  /** Standings in record order. */
  public List<TeamStanding> standings() {
    return teams.stream().map(t -> standings.get(t.number())).collect(Collectors.toList());
  }

  public TeamStanding standing(Team team) {
    return standings.get(team.number());
  }

  public Optional<Team> team(int number) {
    return Optional.ofNullable(standings.get(number)).map(TeamStanding::team);
  }

  public List<Placement> placementsFor(Team team) {
    return placements.stream()
        .filter(p -> p.team().number() == team.number())
        .collect(Collectors.toList());
  }

  public Optional<Placement> placement(Team team, Event event) {
    return placements.stream()
        .filter(p -> p.team().number() == team.number() && p.event().name().equals(event.name()))
        .findFirst();
  }

  /** Parsed source document. */
  public JsonNode raw() {
    return raw;
  }
}
