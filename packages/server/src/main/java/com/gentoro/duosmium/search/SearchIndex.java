package com.gentoro.duosmium.search;

import com.gentoro.duosmium.exception.ValidationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Fuzzy search over the entries of a {@link CorpusSource}. Queries and entry keys go through the
 * same {@link QueryNormalizer}; lower scores are better.
 */
public class SearchIndex {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(SearchIndex.class);

  public static final int DEFAULT_LIMIT = 10;

  private static final Comparator<SearchResult> ORDER =
      Comparator.comparingDouble(SearchResult::score)
          .thenComparing(r -> r.entry().kind())
          .thenComparing(r -> r.entry().id());

  private final CorpusSource source;
  private final FuzzyMatcher matcher;
  private final QueryNormalizer normalizer;

  public SearchIndex(CorpusSource source, FuzzyMatcher matcher, QueryNormalizer normalizer) {
    this.source = source;
    this.matcher = matcher;
    this.normalizer = normalizer;
  }

  public CorpusSource source() {
    return source;
  }

  public List<SearchResult> search(String query, SearchType type, int limit) {
    if (query == null || query.isBlank()) {
      throw new ValidationException("Search query must not be blank");
    }
    if (limit <= 0) {
      throw new ValidationException("Search limit must be positive, got " + limit);
    }
    String normalizedQuery = normalizer.normalize(query);
    if (normalizedQuery.isEmpty()) {
      throw new ValidationException("Search query must contain letters or digits");
    }

    List<SearchEntry> entries = source.entries(type);
    List<SearchResult> matches = new ArrayList<>();
    for (SearchEntry entry : entries) {
      if (!accepts(type, entry.kind())) continue;
      OptionalDouble score =
          matcher.score(
              normalizedQuery,
              normalizer.normalize(entry.name()),
              normalizer.normalize(entry.searchableText()));
      if (score.isPresent()) {
        matches.add(new SearchResult(entry, score.getAsDouble()));
      }
    }
    matches.sort(ORDER);
    log.debug(
        "Search '{}' ({}) over {} {} entries matched {}",
        normalizedQuery,
        type.label(),
        entries.size(),
        source.name(),
        matches.size());
    return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
  }

  private static boolean accepts(SearchType type, EntryKind kind) {
    return kind == EntryKind.TOURNAMENT ? type.includesTournaments() : type.includesTeams();
  }
}
