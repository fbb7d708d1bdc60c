package com.gentoro.duosmium.results.query;

import com.gentoro.duosmium.exception.NotFoundException;
import com.gentoro.duosmium.exception.NotFoundException.EntityKind;
import com.gentoro.duosmium.results.interpreter.Interpretation;
import com.gentoro.duosmium.results.model.Event;
import com.gentoro.duosmium.results.model.Placement;
import com.gentoro.duosmium.results.model.Team;
import com.gentoro.duosmium.results.model.TeamStanding;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/** Read-only questions about one interpreted tournament. */
public class QueryEngine {

  private final Interpretation interpretation;
  private final TeamResolver resolver;

  public QueryEngine(Interpretation interpretation) {
    this.interpretation = interpretation;
    this.resolver = new TeamResolver(interpretation.teams());
  }

  public Interpretation interpretation() {
    return interpretation;
  }

  public Team team(String reference) {
    return resolver.resolve(reference);
  }

  /** Overall standing of a team. */
  public TeamStanding placement(String teamReference) {
    return interpretation.standing(team(teamReference));
  }

  /** Placement of a team in one event. */
  public Placement placement(String teamReference, String eventName) {
    Team team = team(teamReference);
    Event event = event(eventName);
    return interpretation
        .placement(team, event)
        .orElseThrow(
            () ->
                new NotFoundException(
                    EntityKind.PLACEMENT,
                    "No placement found for team \"%s\" (#%d) in event \"%s\""
                        .formatted(team.school(), team.number(), event.name())));
  }

  /** Event by exact name, falling back to a case-insensitive match. */
  public Event event(String name) {
    List<Event> events = interpretation.events();
    return events.stream()
        .filter(e -> e.name().equals(name))
        .findFirst()
        .or(() -> events.stream().filter(e -> e.name().equalsIgnoreCase(name)).findFirst())
        .orElseThrow(
            () ->
                new NotFoundException(
                    EntityKind.EVENT, "Event \"%s\" not found".formatted(name)));
  }

  /** Standings by rank; a positive limit truncates the list without renumbering. */
  public List<TeamStanding> rankings(Integer limit) {
    List<TeamStanding> ranked = interpretation.rankedStandings();
    if (limit != null && limit > 0 && limit < ranked.size()) {
      return ranked.subList(0, limit);
    }
    return ranked;
  }

  /** All teams in record order. */
  public List<TeamStanding> roster() {
    return interpretation.standings();
  }

  /** Every placement of a team, dropped ones included, ordered by event name. */
  public List<Placement> allPlacements(String teamReference) {
    Team team = team(teamReference);
    return interpretation.placementsFor(team).stream()
        .sorted(Comparator.comparing(p -> p.event().name()))
        .collect(Collectors.toList());
  }

  public TournamentInfo info() {
    List<String> teams =
        interpretation.teams().stream()
            .map(t -> "%s (#%d)".formatted(t.school(), t.number()))
            .collect(Collectors.toList());
    List<String> events =
        interpretation.events().stream().map(Event::name).collect(Collectors.toList());
    return new TournamentInfo(
        interpretation.tournament().displayTitle(), teams.size(), teams, events);
  }
}
