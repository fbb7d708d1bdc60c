package com.gentoro.duosmium.tools;

import com.gentoro.duosmium.cache.InterpretationCache;
import com.gentoro.duosmium.exception.NotFoundException;
import com.gentoro.duosmium.exception.ValidationException;
import com.gentoro.duosmium.results.model.Placement;
import com.gentoro.duosmium.results.model.Team;
import com.gentoro.duosmium.results.model.TeamStanding;
import com.gentoro.duosmium.results.query.QueryEngine;
import com.gentoro.duosmium.results.query.TournamentInfo;
import com.gentoro.duosmium.search.SearchIndex;
import com.gentoro.duosmium.search.SearchResult;
import com.gentoro.duosmium.search.SearchType;
import com.gentoro.duosmium.store.ResultsStore;
import com.gentoro.duosmium.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Implements the results tools as plain methods returning the answer text.
 *
 * <p>Expected misses (unknown tournament, team, event or placement) are answered with a readable
 * sentence instead of an exception. Malformed arguments raise {@link ValidationException}; any
 * other failure propagates to the protocol layer.
 */
public class ResultsToolService {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(ResultsToolService.class);

  public static final String RESOURCE_PREFIX = "duosmium://results/";

  private final ResultsStore store;
  private final InterpretationCache interpretations;
  private final SearchIndex searchIndex;
  private final String resultsBaseUrl;

  public ResultsToolService(
      ResultsStore store,
      InterpretationCache interpretations,
      SearchIndex searchIndex,
      String resultsBaseUrl) {
    this.store = store;
    this.interpretations = interpretations;
    this.searchIndex = searchIndex;
    this.resultsBaseUrl =
        resultsBaseUrl.endsWith("/")
            ? resultsBaseUrl.substring(0, resultsBaseUrl.length() - 1)
            : resultsBaseUrl;
  }

  public String listTournaments() {
    List<String> ids = store.listIds();
    return "Available Tournaments (%d):\n%s".formatted(ids.size(), String.join("\n", ids));
  }

  public String tournamentInfo(String tournamentId) {
    requireArgument("tournamentId", tournamentId);
    try {
      TournamentInfo info = engine(tournamentId).info();
      return "Tournament: %s\n\nTeams (%d):\n%s\n\nEvents (%d):\n%s"
          .formatted(
              info.title(),
              info.teamCount(),
              String.join("\n", info.teams()),
              info.events().size(),
              String.join("\n", info.events()));
    } catch (NotFoundException e) {
      return notFound(e, tournamentId, null);
    }
  }

  public String tournamentTeams(String tournamentId) {
    requireArgument("tournamentId", tournamentId);
    try {
      QueryEngine engine = engine(tournamentId);
      List<String> lines = new ArrayList<>();
      for (TeamStanding standing : engine.roster()) {
        Team team = standing.team();
        List<String> parts = new ArrayList<>();
        parts.add("#" + team.number());
        parts.add(team.school());
        if (!team.location().isEmpty()) parts.add("(" + team.location() + ")");
        if (!isBlank(team.suffix())) parts.add("- " + team.suffix());
        String status = status(team, "DQ");
        if (!status.isEmpty()) parts.add("[" + status + "]");
        lines.add(String.join(" ", parts));
      }
      return "Tournament: %s\nTotal Teams: %d\n\nTeams:\n%s"
          .formatted(title(engine), lines.size(), String.join("\n", lines));
    } catch (NotFoundException e) {
      return notFound(e, tournamentId, null);
    }
  }

  /** Overall standing when {@code event} is blank, otherwise the placement in that event. */
  public String teamPlacement(String tournamentId, String teamId, String event) {
    requireArgument("tournamentId", tournamentId);
    requireArgument("teamId", teamId);
    try {
      QueryEngine engine = engine(tournamentId);
      if (isBlank(event)) {
        TeamStanding standing = engine.placement(teamId);
        Team team = standing.team();
        return ("Team: %s (#%d)\nOverall Rank: %s\nTotal Points: %d\nTournament: %s\n"
                + "Disqualified: %s\nExhibition: %s")
            .formatted(
                team.school(),
                team.number(),
                rank(standing),
                standing.points(),
                title(engine),
                yesNo(team.disqualified()),
                yesNo(team.exhibition()));
      }
      Placement placement = engine.placement(teamId, event);
      Team team = placement.team();
      return "Team: %s (#%d)\nEvent: %s\nPlacement: %s\nPoints: %d\nTournament: %s"
          .formatted(
              team.school(),
              team.number(),
              placement.event().name(),
              place(placement),
              placement.points(),
              title(engine));
    } catch (NotFoundException e) {
      return notFound(e, tournamentId, teamId);
    }
  }

  public String teamAllPlacements(String tournamentId, String teamId) {
    requireArgument("tournamentId", tournamentId);
    requireArgument("teamId", teamId);
    try {
      QueryEngine engine = engine(tournamentId);
      Team team = engine.team(teamId);
      List<Placement> placements = engine.allPlacements(teamId);
      if (placements.isEmpty()) {
        return "No placements found for team \"%s\" (#%d)".formatted(team.school(), team.number());
      }
      TeamStanding standing = engine.interpretation().standing(team);

      List<String> teamInfo = new ArrayList<>();
      if (!team.location().isEmpty()) teamInfo.add(team.location());
      if (!isBlank(team.suffix())) teamInfo.add(team.suffix());
      String teamInfoText = teamInfo.isEmpty() ? "" : " (" + String.join(", ", teamInfo) + ")";
      String status = status(team, "Disqualified");
      String statusText = status.isEmpty() ? "" : "\nStatus: " + status;

      String details =
          placements.stream()
              .map(
                  p ->
                      "%s: %s (%d points)%s"
                          .formatted(
                              p.event().name(),
                              place(p),
                              p.points(),
                              p.dropped() ? " [DROPPED]" : ""))
              .collect(Collectors.joining("\n"));
      return ("Team: %s (#%d)%s\nOverall Rank: %s\nTotal Points: %d%s\nTournament: %s\n\n"
              + "Event Placements (%d):\n%s")
          .formatted(
              team.school(),
              team.number(),
              teamInfoText,
              rank(standing),
              standing.points(),
              statusText,
              title(engine),
              placements.size(),
              details);
    } catch (NotFoundException e) {
      return notFound(e, tournamentId, teamId);
    }
  }

  /** Standings in rank order; a positive limit keeps only the first teams. */
  public String tournamentRankings(String tournamentId, Integer limit) {
    requireArgument("tournamentId", tournamentId);
    try {
      QueryEngine engine = engine(tournamentId);
      String rankings =
          engine.rankings(limit).stream()
              .map(
                  s -> {
                    String status = status(s.team(), "DQ");
                    return "%d. %s (#%d) - %d points%s"
                        .formatted(
                            s.rank(),
                            s.team().school(),
                            s.team().number(),
                            s.points(),
                            status.isEmpty() ? "" : " (" + status + ")");
                  })
              .collect(Collectors.joining("\n"));
      return "Tournament: %s\nTotal Teams: %d\n\nRankings:\n%s"
          .formatted(title(engine), engine.interpretation().teams().size(), rankings);
    } catch (NotFoundException e) {
      return notFound(e, tournamentId, null);
    }
  }

  public String search(String query, String type, Integer limit) {
    requireArgument("query", query);
    SearchType searchType = SearchType.parse(type);
    int effectiveLimit = limit == null ? SearchIndex.DEFAULT_LIMIT : limit;
    List<SearchResult> results = searchIndex.search(query, searchType, effectiveLimit);
    if (results.isEmpty()) {
      String what =
          searchType == SearchType.BOTH ? "tournaments or teams" : searchType.label() + "s";
      return "No %s found matching \"%s\"".formatted(what, query);
    }
    String lines =
        results.stream()
            .map(
                r -> {
                  String details = r.entry().details();
                  return "%s: %s\n%s%s"
                      .formatted(
                          r.entry().kind(),
                          r.entry().id(),
                          r.entry().name(),
                          isBlank(details) ? "" : " | " + details);
                })
            .collect(Collectors.joining("\n\n"));
    return "Search results for \"%s\" (%d found):\n\n%s".formatted(query, results.size(), lines);
  }

  /** The full record as JSON: id, display title, raw record tree and public results URL. */
  public String fetch(String id) {
    requireArgument("id", id);
    try {
      var interpretation = interpretations.get(id);
      Map<String, Object> document = new LinkedHashMap<>();
      document.put("id", id);
      document.put("title", interpretation.tournament().displayTitle());
      document.put("text", interpretation.raw());
      document.put("url", resultsBaseUrl + "/" + id);
      return JacksonUtility.toJson(document);
    } catch (NotFoundException e) {
      return notFound(e, id, null);
    }
  }

  /**
   * Raw YAML behind a {@code duosmium://results/<id>} URI.
   *
   * @throws ValidationException for a URI outside the results scheme
   * @throws NotFoundException when no such tournament exists
   */
  public String readResource(String uri) {
    if (uri == null || !uri.startsWith(RESOURCE_PREFIX)) {
      throw new ValidationException(
          "Invalid URI scheme. Expected " + RESOURCE_PREFIX + "{id}, got " + uri);
    }
    return store.read(uri.substring(RESOURCE_PREFIX.length()));
  }

  public List<String> tournamentIds() {
    return store.listIds();
  }

  private QueryEngine engine(String tournamentId) {
    return new QueryEngine(interpretations.get(tournamentId.trim()));
  }

  private static String notFound(NotFoundException e, String tournamentId, String teamId) {
    log.debug("Not found while answering for {}: {}", tournamentId, e.getMessage());
    return switch (e.getKind()) {
      case TOURNAMENT -> "Tournament \"%s\" not found".formatted(tournamentId);
      case TEAM -> "Team \"%s\" not found in tournament \"%s\"".formatted(teamId, tournamentId);
      case EVENT -> "%s in tournament \"%s\"".formatted(e.getMessage(), tournamentId);
      case PLACEMENT -> e.getMessage();
    };
  }

  private static String title(QueryEngine engine) {
    return engine.interpretation().tournament().displayTitle();
  }

  private static String place(Placement placement) {
    String place = placement.place() == 0 ? "DQ/NS" : String.valueOf(placement.place());
    return placement.tie() ? place + " (tie)" : place;
  }

  private static String rank(TeamStanding standing) {
    return standing.tie() ? standing.rank() + " (tie)" : String.valueOf(standing.rank());
  }

  private static String status(Team team, String disqualifiedLabel) {
    List<String> status = new ArrayList<>(2);
    if (team.disqualified()) status.add(disqualifiedLabel);
    if (team.exhibition()) status.add("Exhibition");
    return String.join(", ", status);
  }

  private static String yesNo(boolean value) {
    return value ? "Yes" : "No";
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static void requireArgument(String name, String value) {
    if (isBlank(value)) {
      throw new ValidationException("Missing required argument '%s'".formatted(name));
    }
  }
}
