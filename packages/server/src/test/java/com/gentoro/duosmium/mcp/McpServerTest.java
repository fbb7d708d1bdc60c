package com.gentoro.duosmium.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.gentoro.duosmium.Fixtures;
import com.gentoro.duosmium.cache.InterpretationCache;
import com.gentoro.duosmium.exception.ValidationException;
import com.gentoro.duosmium.search.FuzzyMatcher;
import com.gentoro.duosmium.search.LocalCorpusSource;
import com.gentoro.duosmium.search.QueryNormalizer;
import com.gentoro.duosmium.search.SearchIndex;
import com.gentoro.duosmium.store.ResultsStore;
import com.gentoro.duosmium.tools.ResultsToolService;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class McpServerTest {

  private ExecutorService executor;
  private ResultsToolService tools;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadExecutor();
    ResultsStore store = Fixtures.store();
    InterpretationCache cache = Fixtures.cache(store);
    tools =
        new ResultsToolService(
            store,
            cache,
            new SearchIndex(
                new LocalCorpusSource(store, cache, executor),
                new FuzzyMatcher(0.4, 2, 1),
                new QueryNormalizer()),
            "https://www.duosmium.org/results");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("All results tools are advertised with their input schemas")
  void toolCatalogue() {
    List<McpServerFeatures.SyncToolSpecification> specs = McpServer.tools(tools);

    assertThat(specs)
        .extracting(s -> s.tool().name())
        .containsExactly(
            "get_team_placement",
            "get_tournament_rankings",
            "list_tournaments",
            "get_tournament_info",
            "get_tournament_teams",
            "get_team_all_placements",
            "search",
            "fetch");
    McpSchema.JsonSchema placement = specs.get(0).tool().inputSchema();
    assertThat(placement.required()).containsExactly("tournamentId", "teamId");
    assertThat(placement.properties()).containsKeys("tournamentId", "teamId", "event");
  }

  @Test
  @DisplayName("Invalid arguments become INVALID_PARAMS errors")
  void validationMapsToInvalidParams() {
    McpError error =
        assertThrows(
            McpError.class,
            () ->
                McpServer.invoke(
                    "search",
                    "search",
                    args -> tools.search(McpServer.string(args, "query"), null, null),
                    Map.of()));

    assertThat(error.getJsonRpcError().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
    assertThat(error.getJsonRpcError().message()).contains("query");
  }

  @Test
  @DisplayName("Unexpected failures become INTERNAL_ERROR with the action in the message")
  void failuresMapToInternalError() {
    McpError error =
        assertThrows(
            McpError.class,
            () ->
                McpServer.invoke(
                    "fetch",
                    "fetch tournament data",
                    args -> {
                      throw new IllegalStateException("disk on fire");
                    },
                    Map.of()));

    assertThat(error.getJsonRpcError().code()).isEqualTo(McpSchema.ErrorCodes.INTERNAL_ERROR);
    assertThat(error.getJsonRpcError().message())
        .startsWith("Failed to fetch tournament data:")
        .contains("disk on fire");
  }

  @Test
  @DisplayName("Expected misses come back as plain answers")
  void missesAreAnswers() {
    String answer =
        McpServer.invoke(
            "get_tournament_info",
            "get tournament info",
            args -> tools.tournamentInfo(McpServer.string(args, "tournamentId")),
            Map.of("tournamentId", "nope"));
    assertThat(answer).isEqualTo("Tournament \"nope\" not found");
  }

  @Test
  @DisplayName("Integer arguments accept numbers and numeric text")
  void integerArguments() {
    assertThat(McpServer.integer(Map.of("limit", 5), "limit")).isEqualTo(5);
    assertThat(McpServer.integer(Map.of("limit", 5.0d), "limit")).isEqualTo(5);
    assertThat(McpServer.integer(Map.of("limit", " 7 "), "limit")).isEqualTo(7);
    assertThat(McpServer.integer(Map.of(), "limit")).isNull();
    assertThatThrownBy(() -> McpServer.integer(Map.of("limit", 2.5d), "limit"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> McpServer.integer(Map.of("limit", "ten"), "limit"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  @DisplayName("Resources resolve through the results scheme")
  void resources() {
    McpSchema.ReadResourceResult result =
        McpServer.readResource(tools, ResultsToolService.RESOURCE_PREFIX + Fixtures.DEMO);
    McpSchema.TextResourceContents contents =
        (McpSchema.TextResourceContents) result.contents().get(0);
    assertThat(contents.mimeType()).isEqualTo(McpServer.YAML_MIME);
    assertThat(contents.text()).contains("Demo Invitational 2024");

    McpError missing =
        assertThrows(
            McpError.class,
            () -> McpServer.readResource(tools, ResultsToolService.RESOURCE_PREFIX + "missing"));
    assertThat(missing.getJsonRpcError().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST);
    assertThat(missing.getJsonRpcError().message()).isEqualTo("Resource not found: missing");

    McpError scheme =
        assertThrows(McpError.class, () -> McpServer.readResource(tools, "http://example.com/x"));
    assertThat(scheme.getJsonRpcError().message()).startsWith("Invalid URI scheme");
  }
}
