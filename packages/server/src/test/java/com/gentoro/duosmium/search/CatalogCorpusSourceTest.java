package com.gentoro.duosmium.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gentoro.duosmium.exception.FetchException;
import com.gentoro.duosmium.http.OkHttpFactory;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CatalogCorpusSourceTest {

  private static final String TOURNAMENTS =
      """
      [
        {"filename": "2023-02-04_troy_invitational_c.yaml", "title": "Troy Invitational",
         "location": "Troy High School", "division": "C", "year": 2023, "official": false,
         "keywords": ["troy", "fullerton"]},
        {"id": "2019-06-01_nationals_c", "name": "Science Olympiad National Tournament",
         "location": "Cornell University", "division": "C", "year": 2019, "official": true},
        {"title": "entry without an id"}
      ]
      """;

  private static final String SCHOOLS =
      """
      name,city,state
      Troy High School,Fullerton,CA
      Solon High School,Solon,OH
      ,Nowhere,ZZ
      """;

  private HttpServer server;
  private ExecutorService executor;
  private String baseUrl;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/tournaments.json", ex -> respond(ex, 200, TOURNAMENTS));
    server.createContext("/schools.csv", ex -> respond(ex, 200, SCHOOLS));
    server.createContext("/broken", ex -> respond(ex, 500, "boom"));
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    executor = Executors.newFixedThreadPool(2);
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
    executor.shutdownNow();
  }

  private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
      throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  private CatalogCorpusSource source(String tournamentsPath, String schoolsPath) {
    return new CatalogCorpusSource(
        OkHttpFactory.create(Duration.ofSeconds(5)),
        baseUrl + tournamentsPath,
        baseUrl + schoolsPath,
        Duration.ofSeconds(5),
        executor);
  }

  @Test
  @DisplayName("Tournament metadata and school rows become entries")
  void readsBothDocuments() {
    List<SearchEntry> entries =
        source("/tournaments.json", "/schools.csv").entries(SearchType.BOTH);

    assertThat(entries)
        .extracting(SearchEntry::id)
        .containsExactly(
            "2023-02-04_troy_invitational_c",
            "2019-06-01_nationals_c",
            "Troy High School (Fullerton, CA)",
            "Solon High School (Solon, OH)");

    SearchEntry troy = entries.get(0);
    assertThat(troy.kind()).isEqualTo(EntryKind.TOURNAMENT);
    assertThat(troy.name()).isEqualTo("Troy Invitational");
    assertThat(troy.details()).isEqualTo("Troy High School | Division C | 2023");
    assertThat(troy.searchableText()).contains("fullerton");

    assertThat(entries.get(1).details()).endsWith("official");
    assertThat(entries.get(2).kind()).isEqualTo(EntryKind.SCHOOL);
    assertThat(entries.get(2).details()).isEqualTo("Fullerton, CA");
  }

  @Test
  @DisplayName("Only the documents needed for the requested type are fetched")
  void fetchesOnlyWhatIsNeeded() {
    List<SearchEntry> tournaments =
        source("/tournaments.json", "/broken").entries(SearchType.TOURNAMENT);
    assertThat(tournaments).allSatisfy(e -> assertThat(e.kind()).isEqualTo(EntryKind.TOURNAMENT));

    List<SearchEntry> schools = source("/broken", "/schools.csv").entries(SearchType.TEAM);
    assertThat(schools).hasSize(2);
  }

  @Test
  @DisplayName("A failing catalog endpoint fails the whole call")
  void serverErrorFails() {
    assertThatThrownBy(() -> source("/tournaments.json", "/broken").entries(SearchType.BOTH))
        .isInstanceOf(FetchException.class)
        .hasMessageContaining("500");
  }

  @Test
  @DisplayName("A catalog that is not a JSON list is rejected")
  void rejectsNonList() {
    CatalogCorpusSource source = source("/tournaments.json", "/schools.csv");
    assertThatThrownBy(() -> source.tournamentEntries("{\"a\": 1}"))
        .isInstanceOf(FetchException.class)
        .hasMessageContaining("JSON list");
  }

  @Test
  @DisplayName("An unreachable catalog fails with a fetch error")
  void unreachable() throws IOException {
    int port;
    try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    CatalogCorpusSource source =
        new CatalogCorpusSource(
            OkHttpFactory.create(Duration.ofSeconds(2)),
            "http://127.0.0.1:" + port + "/tournaments.json",
            "http://127.0.0.1:" + port + "/schools.csv",
            Duration.ofSeconds(2),
            executor);
    assertThatThrownBy(() -> source.entries(SearchType.BOTH)).isInstanceOf(FetchException.class);
  }
}
