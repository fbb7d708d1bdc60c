package com.gentoro.duosmium.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.gentoro.duosmium.exception.ExceptionUtil;
import com.gentoro.duosmium.exception.FetchException;
import com.gentoro.duosmium.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Entries from the external read-only catalog: a JSON list of tournament metadata and a CSV school
 * directory ({@code name,city,state}). Both documents are fetched on every call, concurrently; if
 * either fetch fails or exceeds the timeout the whole call fails with a {@link FetchException}.
 */
public class CatalogCorpusSource implements CorpusSource {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(CatalogCorpusSource.class);

  private final OkHttpClient client;
  private final String tournamentsUrl;
  private final String schoolsUrl;
  private final Duration timeout;
  private final Executor executor;

  public CatalogCorpusSource(
      OkHttpClient client,
      String tournamentsUrl,
      String schoolsUrl,
      Duration timeout,
      Executor executor) {
    this.client = client;
    this.tournamentsUrl = tournamentsUrl;
    this.schoolsUrl = schoolsUrl;
    this.timeout = timeout;
    this.executor = executor;
  }

  @Override
  public String name() {
    return "catalog";
  }

  @Override
  public List<SearchEntry> entries(SearchType type) {
    CompletableFuture<List<SearchEntry>> tournaments =
        type.includesTournaments()
            ? CompletableFuture.supplyAsync(
                () -> tournamentEntries(fetch(tournamentsUrl)), executor)
            : CompletableFuture.completedFuture(Collections.emptyList());
    CompletableFuture<List<SearchEntry>> schools =
        type.includesTeams()
            ? CompletableFuture.supplyAsync(() -> schoolEntries(fetch(schoolsUrl)), executor)
            : CompletableFuture.completedFuture(Collections.emptyList());

    try {
      CompletableFuture.allOf(tournaments, schools)
          .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      List<SearchEntry> entries = new ArrayList<>(tournaments.join());
      entries.addAll(schools.join());
      return entries;
    } catch (ExecutionException e) {
      tournaments.cancel(true);
      schools.cancel(true);
      Throwable cause = e.getCause() == null ? e : e.getCause();
      throw ExceptionUtil.rethrowIfUnchecked(
          cause,
          ex -> new FetchException("Catalog fetch failed: " + ExceptionUtil.describe(ex), ex));
    } catch (TimeoutException e) {
      tournaments.cancel(true);
      schools.cancel(true);
      throw new FetchException("Catalog fetch timed out after " + timeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException("Catalog fetch interrupted", e);
    }
  }

  String fetch(String url) {
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = client.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new FetchException("GET %s returned HTTP %d".formatted(url, response.code()));
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new FetchException("GET %s returned an empty body".formatted(url));
      }
      return body.string();
    } catch (IOException e) {
      throw new FetchException("GET %s failed: %s".formatted(url, e.getMessage()), e);
    }
  }

  List<SearchEntry> tournamentEntries(String json) {
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(json);
    } catch (IOException e) {
      throw new FetchException("Tournament catalog is not valid JSON", e);
    }
    if (root == null || !root.isArray()) {
      throw new FetchException("Tournament catalog must be a JSON list");
    }
    List<SearchEntry> entries = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      String id = stripExtension(firstText(node, "filename", "id"));
      if (id == null) continue;
      String title = firstText(node, "title", "name");
      if (title == null) title = id;
      String location = firstText(node, "location");
      String division = firstText(node, "division");
      String year = firstText(node, "year");
      boolean official = node.path("official").asBoolean(false);
      String keywords = keywords(node.get("keywords"));
      String details =
          joinDetails(
              location,
              division == null ? null : "Division " + division,
              year,
              official ? "official" : null);
      entries.add(
          new SearchEntry(
              EntryKind.TOURNAMENT,
              id,
              title,
              details,
              LocalCorpusSource.join(title, location, id, division, year, keywords)));
    }
    log.debug("Catalog listed {} tournaments", entries.size());
    return entries;
  }

  List<SearchEntry> schoolEntries(String csv) {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<SearchEntry> entries = new ArrayList<>();
    try (MappingIterator<Map<String, String>> rows =
        JacksonUtility.getCsvMapper()
            .readerFor(Map.class)
            .with(schema)
            .readValues(csv)) {
      while (rows.hasNext()) {
        Map<String, String> row = rows.next();
        String name = trimToNull(row.get("name"));
        if (name == null) continue;
        String city = trimToNull(row.get("city"));
        String state = trimToNull(row.get("state"));
        String place =
            city != null && state != null ? city + ", " + state : city != null ? city : state;
        String id = place == null ? name : "%s (%s)".formatted(name, place);
        entries.add(
            new SearchEntry(
                EntryKind.SCHOOL,
                id,
                name,
                place == null ? "" : place,
                LocalCorpusSource.join(name, city, state)));
      }
    } catch (IOException | RuntimeException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new FetchException("School directory is not valid CSV", ex));
    }
    log.debug("Catalog listed {} schools", entries.size());
    return entries;
  }

  private static String joinDetails(String... parts) {
    return Stream.of(parts)
        .filter(p -> p != null && !p.isBlank())
        .collect(Collectors.joining(" | "));
  }

  private static String keywords(JsonNode node) {
    if (node == null || node.isNull()) return null;
    if (node.isArray()) {
      List<String> words = new ArrayList<>();
      node.forEach(k -> words.add(k.asText()));
      return String.join(" ", words);
    }
    return node.asText();
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && !value.isNull() && !value.asText().isBlank()) {
        return value.asText().trim();
      }
    }
    return null;
  }

  private static String stripExtension(String filename) {
    if (filename == null) return null;
    return filename.endsWith(".yaml") ? filename.substring(0, filename.length() - 5) : filename;
  }

  private static String trimToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
