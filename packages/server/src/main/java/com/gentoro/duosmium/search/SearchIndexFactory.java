package com.gentoro.duosmium.search;

import com.gentoro.duosmium.ConfigurationProvider;
import com.gentoro.duosmium.cache.InterpretationCache;
import com.gentoro.duosmium.exception.ConfigException;
import com.gentoro.duosmium.http.OkHttpFactory;
import com.gentoro.duosmium.store.ResultsStore;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import org.apache.commons.configuration2.Configuration;

/**
 * Creates the {@link SearchIndex} described by the {@code search.*} configuration.
 *
 * <p>Example configuration:
 *
 * <pre>
 *   search.source = catalog
 *   search.catalog.tournaments-url = https://example.org/tournaments.json
 *   search.catalog.schools-url = https://example.org/schools.csv
 *   search.catalog.timeout-seconds = 10
 *   search.fuzzy.threshold = 0.4
 * </pre>
 */
public final class SearchIndexFactory {
  private SearchIndexFactory() {}

  public static SearchIndex create(
      Configuration cfg,
      ResultsStore store,
      InterpretationCache interpretations,
      ExecutorService executor) {
    return new SearchIndex(
        createSource(cfg, store, interpretations, executor), matcher(cfg), new QueryNormalizer());
  }

  static CorpusSource createSource(
      Configuration cfg,
      ResultsStore store,
      InterpretationCache interpretations,
      ExecutorService executor) {
    String source =
        ConfigurationProvider.resolvedString(cfg, "search.source", "corpus")
            .toLowerCase(Locale.ROOT);
    switch (source) {
      case "corpus":
        return new LocalCorpusSource(store, interpretations, executor);
      case "catalog":
        Duration timeout =
            Duration.ofSeconds(
                ConfigurationProvider.resolvedInt(cfg, "search.catalog.timeout-seconds", 10));
        return new CatalogCorpusSource(
            OkHttpFactory.create(timeout),
            requireUrl(cfg, "search.catalog.tournaments-url"),
            requireUrl(cfg, "search.catalog.schools-url"),
            timeout,
            executor);
      default:
        throw new ConfigException(
            "Unknown search.source '%s'; expected corpus or catalog".formatted(source));
    }
  }

  static FuzzyMatcher matcher(Configuration cfg) {
    try {
      return new FuzzyMatcher(
          cfg.getDouble("search.fuzzy.threshold", 0.4),
          cfg.getDouble("search.fuzzy.name-weight", 2.0),
          cfg.getDouble("search.fuzzy.text-weight", 1.0));
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid search.fuzzy configuration: " + e.getMessage(), e);
    }
  }

  private static String requireUrl(Configuration cfg, String key) {
    String url = ConfigurationProvider.resolvedString(cfg, key, null);
    if (url == null) {
      throw new ConfigException(
          "Missing %s configuration for search.source=catalog".formatted(key));
    }
    return url;
  }
}
