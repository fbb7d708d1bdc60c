package com.gentoro.duosmium.results.interpreter;

import com.gentoro.duosmium.exception.ConsistencyException;
import com.gentoro.duosmium.results.model.Event;
import com.gentoro.duosmium.results.model.LoadedRecord;
import com.gentoro.duosmium.results.model.PenaltyRecord;
import com.gentoro.duosmium.results.model.Placement;
import com.gentoro.duosmium.results.model.PlacingRecord;
import com.gentoro.duosmium.results.model.Team;
import com.gentoro.duosmium.results.model.TeamStanding;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Derives placements, totals and ranks from a loaded record.
 *
 * <p>Scoring rules:
 *
 * <ul>
 *   <li><b>Pools.</b> Only official teams (neither exhibition nor disqualified) take place and rank
 *       slots. Exhibition and disqualified teams get the place/rank they would have had against the
 *       official pool, which never shifts anybody else.
 *   <li><b>Event places.</b> Qualifying placings (participated, not disqualified, place &gt; 0) are
 *       ordered by their recorded place, or by raw score when the event is scored raw, using
 *       standard competition ranking. Points equal the place.
 *   <li><b>Disqualified / no-show.</b> Place 0; points are {@code M + 2} for a disqualification and
 *       {@code M + 1} for a no-show, where {@code M} is the tournament maximum place or the number
 *       of official teams.
 *   <li><b>Drops.</b> Each team drops its {@code N} highest-point placings, disqualified placings
 *       excluded. At equal points the event whose name sorts first is dropped first.
 *   <li><b>Totals and ranks.</b> Total is the sum of non-dropped points plus penalties. Official
 *       teams are ranked by total; disqualified teams follow all official teams.
 * </ul>
 */
public class Interpreter {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(Interpreter.class);

  public Interpretation interpret(LoadedRecord record) {
    String id = record.tournament().id();
    Map<String, Event> events = new LinkedHashMap<>();
    record.events().forEach(e -> events.put(e.name(), e));
    Map<Integer, Team> teams = new LinkedHashMap<>();
    record.teams().forEach(t -> teams.put(t.number(), t));

    checkReferences(id, record, events, teams);

    int officialCount = (int) teams.values().stream().filter(Team::official).count();
    int maximumPlace = record.tournament().maximumPlace().orElse(officialCount);

    List<Placement> placements = new ArrayList<>();
    for (Event event : events.values()) {
      List<PlacingRecord> eventPlacings =
          record.placings().stream()
              .filter(p -> p.eventName().equals(event.name()))
              .collect(Collectors.toList());
      placements.addAll(placeEvent(id, event, eventPlacings, teams, maximumPlace));
    }

    placements = applyDrops(placements, record.tournament().droppedPlacings());

    Map<Integer, Integer> totals = new HashMap<>();
    teams.keySet().forEach(n -> totals.put(n, 0));
    for (Placement p : placements) {
      if (!p.dropped()) totals.merge(p.team().number(), p.points(), Integer::sum);
    }
    for (PenaltyRecord penalty : record.penalties()) {
      totals.merge(penalty.teamNumber(), penalty.points(), Integer::sum);
    }

    Map<Integer, TeamStanding> standings = rankTeams(teams, totals);

    // record order for placements within a team is event order; sort once for stable output
    Map<String, Integer> eventOrder = new HashMap<>();
    int idx = 0;
    for (String name : events.keySet()) eventOrder.put(name, idx++);
    placements.sort(
        Comparator.comparingInt((Placement p) -> p.team().number())
            .thenComparingInt(p -> eventOrder.get(p.event().name())));

    log.debug(
        "Interpreted {}: {} teams ({} official), {} events, {} placements",
        id,
        teams.size(),
        officialCount,
        events.size(),
        placements.size());
    return new Interpretation(
        record.tournament(),
        record.events(),
        record.teams(),
        placements,
        standings,
        record.raw());
  }

  private static void checkReferences(
      String id, LoadedRecord record, Map<String, Event> events, Map<Integer, Team> teams) {
    for (PlacingRecord p : record.placings()) {
      if (!events.containsKey(p.eventName())) {
        throw new ConsistencyException(
            "Tournament '%s': placing of team %d references undeclared event '%s'"
                .formatted(id, p.teamNumber(), p.eventName()));
      }
      if (!teams.containsKey(p.teamNumber())) {
        throw new ConsistencyException(
            "Tournament '%s': placing in event '%s' references undeclared team %d"
                .formatted(id, p.eventName(), p.teamNumber()));
      }
    }
    for (PenaltyRecord p : record.penalties()) {
      if (!teams.containsKey(p.teamNumber())) {
        throw new ConsistencyException(
            "Tournament '%s': penalty references undeclared team %d"
                .formatted(id, p.teamNumber()));
      }
    }
  }

  private static boolean qualifies(PlacingRecord p) {
    return p.participated()
        && !p.disqualified()
        && (p.place() == null ? p.rawScore() != null : p.place() > 0);
  }

  private List<Placement> placeEvent(
      String id,
      Event event,
      List<PlacingRecord> placings,
      Map<Integer, Team> teams,
      int maximumPlace) {
    List<PlacingRecord> qualifying =
        placings.stream().filter(Interpreter::qualifies).collect(Collectors.toList());

    long withPlace = qualifying.stream().filter(p -> p.place() != null).count();
    boolean rawScored = withPlace == 0 && !qualifying.isEmpty();
    if (withPlace > 0 && withPlace < qualifying.size()) {
      throw new ConsistencyException(
          "Tournament '%s': event '%s' mixes explicit places and raw scores"
              .formatted(id, event.name()));
    }

    java.util.function.ToDoubleFunction<PlacingRecord> key =
        p -> {
          if (!rawScored) return p.place();
          return event.lowestWins() ? p.rawScore() : -p.rawScore();
        };

    List<PlacingRecord> pool =
        qualifying.stream()
            .filter(p -> teams.get(p.teamNumber()).official())
            .collect(Collectors.toList());
    Map<PlacingRecord, CompetitionRanking.Ranked<PlacingRecord>> ranked = new HashMap<>();
    for (CompetitionRanking.Ranked<PlacingRecord> r : CompetitionRanking.rank(pool, key)) {
      ranked.put(r.item(), r);
    }
    double[] poolKeys =
        CompetitionRanking.keys(
            pool.stream().map(p -> key.applyAsDouble(p)).collect(Collectors.toList()));

    List<Placement> out = new ArrayList<>(placings.size());
    for (PlacingRecord p : placings) {
      Team team = teams.get(p.teamNumber());
      int place;
      boolean tie;
      int points;
      if (!qualifies(p)) {
        place = 0;
        tie = false;
        points = p.disqualified() ? maximumPlace + 2 : maximumPlace + 1;
      } else if (team.official()) {
        CompetitionRanking.Ranked<PlacingRecord> r = ranked.get(p);
        place = r.rank();
        tie = r.tie();
        points = place;
      } else {
        CompetitionRanking.Isolated r =
            CompetitionRanking.isolated(key.applyAsDouble(p), poolKeys);
        place = r.rank();
        tie = r.tie();
        points = place;
      }
      out.add(
          new Placement(
              team, event, place, tie, points, false, p.participated(), p.disqualified(),
              p.rawScore()));
    }
    return out;
  }

  /**
   * Marks the {@code dropCount} worst placings of every team as dropped. Worst means most points;
   * ties at the cut-off are broken by event name ascending, so "Anatomy" is dropped before
   * "Zoology" when both sit on the boundary.
   */
  static List<Placement> applyDrops(List<Placement> placements, int dropCount) {
    if (dropCount <= 0) return new ArrayList<>(placements);

    Map<Integer, List<Placement>> byTeam = new LinkedHashMap<>();
    for (Placement p : placements) {
      byTeam.computeIfAbsent(p.team().number(), k -> new ArrayList<>()).add(p);
    }

    java.util.Set<Placement> toDrop =
        java.util.Collections.newSetFromMap(new java.util.IdentityHashMap<>());
    for (List<Placement> teamPlacements : byTeam.values()) {
      teamPlacements.stream()
          .filter(p -> !p.disqualified())
          .sorted(
              Comparator.comparingInt(Placement::points)
                  .reversed()
                  .thenComparing(p -> p.event().name()))
          .limit(dropCount)
          .forEach(toDrop::add);
    }

    List<Placement> out = new ArrayList<>(placements.size());
    for (Placement p : placements) {
      out.add(toDrop.contains(p) ? p.asDropped() : p);
    }
    return out;
  }

  private static Map<Integer, TeamStanding> rankTeams(
      Map<Integer, Team> teams, Map<Integer, Integer> totals) {
    List<Team> official =
        teams.values().stream().filter(Team::official).collect(Collectors.toList());
    List<Team> disqualified =
        teams.values().stream()
            .filter(t -> t.disqualified() && !t.exhibition())
            .collect(Collectors.toList());

    Map<Integer, TeamStanding> standings = new LinkedHashMap<>();
    for (CompetitionRanking.Ranked<Team> r :
        CompetitionRanking.rank(official, t -> totals.get(t.number()))) {
      Team t = r.item();
      standings.put(t.number(), new TeamStanding(t, totals.get(t.number()), r.rank(), r.tie()));
    }
    for (CompetitionRanking.Ranked<Team> r :
        CompetitionRanking.rank(disqualified, t -> totals.get(t.number()))) {
      Team t = r.item();
      standings.put(
          t.number(),
          new TeamStanding(t, totals.get(t.number()), official.size() + r.rank(), r.tie()));
    }

    double[] officialTotals =
        CompetitionRanking.keys(
            official.stream()
                .map(t -> totals.get(t.number()).doubleValue())
                .collect(Collectors.toList()));
    for (Team t : teams.values()) {
      if (!t.exhibition()) continue;
      int total = totals.get(t.number());
      CompetitionRanking.Isolated r = CompetitionRanking.isolated(total, officialTotals);
      standings.put(t.number(), new TeamStanding(t, total, r.rank(), r.tie()));
    }

    // keep record order
    Map<Integer, TeamStanding> ordered = new LinkedHashMap<>();
    teams.keySet().forEach(n -> ordered.put(n, standings.get(n)));
    return ordered;
  }
}
