package com.gentoro.duosmium.search;

import com.gentoro.duosmium.cache.InterpretationCache;
import com.gentoro.duosmium.results.interpreter.Interpretation;
import com.gentoro.duosmium.results.model.Team;
import com.gentoro.duosmium.results.model.TeamStanding;
import com.gentoro.duosmium.results.model.Tournament;
import com.gentoro.duosmium.store.ResultsStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds entries from every record in the local store. Records are loaded in parallel through the
 * interpretation cache; a record that fails to load or interpret is logged and left out, so the
 * corpus may be partial.
 */
public class LocalCorpusSource implements CorpusSource {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(LocalCorpusSource.class);

  private final ResultsStore store;
  private final InterpretationCache interpretations;
  private final ExecutorService executor;

  public LocalCorpusSource(
      ResultsStore store, InterpretationCache interpretations, ExecutorService executor) {
    this.store = store;
    this.interpretations = interpretations;
    this.executor = executor;
  }

  @Override
  public String name() {
    return "corpus";
  }

  @Override
  public List<SearchEntry> entries(SearchType type) {
    List<String> ids = store.listIds();
    List<Future<List<SearchEntry>>> futures = new ArrayList<>(ids.size());
    for (String id : ids) {
      futures.add(executor.submit(() -> entriesOf(id, type)));
    }

    List<SearchEntry> entries = new ArrayList<>();
    int skipped = 0;
    try {
      for (int i = 0; i < futures.size(); i++) {
        try {
          entries.addAll(futures.get(i).get());
        } catch (ExecutionException | CancellationException e) {
          skipped++;
          Throwable cause = e.getCause() == null ? e : e.getCause();
          log.warn("Skipping tournament {} in search corpus: {}", ids.get(i), cause.getMessage());
          log.debug("Corpus load failure for {}", ids.get(i), cause);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      futures.forEach(f -> f.cancel(true));
      log.info("Corpus aggregation interrupted after {} entries", entries.size());
      return entries;
    }
    log.debug(
        "Aggregated {} entries from {} tournaments ({} skipped)",
        entries.size(),
        ids.size(),
        skipped);
    return entries;
  }

  private List<SearchEntry> entriesOf(String id, SearchType type) {
    Interpretation interpretation = interpretations.get(id);
    Tournament tournament = interpretation.tournament();
    String title = tournament.displayTitle();

    List<SearchEntry> entries = new ArrayList<>();
    if (type.includesTournaments()) {
      entries.add(
          new SearchEntry(
              EntryKind.TOURNAMENT,
              id,
              title,
              "%d teams, %d events"
                  .formatted(interpretation.teams().size(), interpretation.events().size()),
              join(title, id, tournament.location(), tournament.state())));
    }
    if (type.includesTeams()) {
      for (TeamStanding standing : interpretation.standings()) {
        Team team = standing.team();
        String location = team.location();
        String details =
            Stream.of(
                    "#" + team.number(),
                    location.isEmpty() ? null : "(" + location + ")",
                    "Rank: " + standing.rank(),
                    "in " + title)
                .filter(s -> s != null)
                .collect(Collectors.joining(" "));
        entries.add(
            new SearchEntry(
                EntryKind.TEAM,
                id + ":" + team.number(),
                team.school(),
                details,
                join(
                    team.school(),
                    team.suffix(),
                    location,
                    String.valueOf(team.number()),
                    title)));
      }
    }
    return entries.isEmpty() ? Collections.emptyList() : entries;
  }

  static String join(String... parts) {
    return Stream.of(parts)
        .filter(p -> p != null && !p.isBlank())
        .collect(Collectors.joining(" "));
  }
}
