package com.gentoro.duosmium.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.duosmium.ConfigurationProvider;
import com.gentoro.duosmium.DuosmiumMcp;
import com.gentoro.duosmium.exception.ExceptionUtil;
import com.gentoro.duosmium.exception.NotFoundException;
import com.gentoro.duosmium.exception.ValidationException;
import com.gentoro.duosmium.tools.ResultsToolService;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Streamable-HTTP MCP endpoint exposing the results tools and the raw records as resources.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) – servlet path; default: "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) – reject HTTP DELETE; default: false
 *   <li><b>http.mcp.server.name</b> (string) – name reported to clients; default: "duosmium-mcp"
 *   <li><b>http.mcp.server.version</b> (string) – version reported to clients; default: "0.0.1"
 * </ul>
 *
 * <p>Tool failures are mapped to protocol errors: invalid arguments become {@code INVALID_PARAMS},
 * anything else {@code INTERNAL_ERROR} with a "Failed to ..." message. Expected misses never get
 * here; the tool service answers them in text.
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(McpServer.class);

  static final String YAML_MIME = "application/x-yaml";

  private final DuosmiumMcp app;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(DuosmiumMcp app) {
    this.app = app;
  }

  /** Build the MCP server and mount its servlet on the shared Jetty context. */
  public void register() {
    Configuration cfg = app.configuration();
    String endpoint =
        normalizeEndpoint(ConfigurationProvider.resolvedString(cfg, "http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = cfg.getBoolean("http.mcp.disallow-delete", false);
    String serverName =
        ConfigurationProvider.resolvedString(cfg, "http.mcp.server.name", "duosmium-mcp");
    String serverVersion =
        ConfigurationProvider.resolvedString(cfg, "http.mcp.server.version", "0.0.1");

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    ResultsToolService tools = app.toolService();
    List<McpServerFeatures.SyncResourceSpecification> resources = resources(tools);
    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(
                McpSchema.ServerCapabilities.builder()
                    .tools(true)
                    .resources(false, false)
                    .logging()
                    .build())
            .tools(tools(tools))
            .resources(resources)
            .resourceTemplates(List.of(resourceTemplate(tools)))
            .build();

    app.httpServer().getContextHandler().addServlet(new ServletHolder(servletTransport), endpoint);
    log.info(
        "MCP servlet registered at http://localhost:{}{} ({} tournament resources)",
        app.httpServer().getPort(),
        endpoint,
        resources.size());
  }

  static List<McpServerFeatures.SyncToolSpecification> tools(ResultsToolService tools) {
    List<McpServerFeatures.SyncToolSpecification> specs = new ArrayList<>();
    specs.add(
        tool(
            "get_team_placement",
            "Get a team's placement in a specific event or its overall tournament ranking. If no"
                + " event is specified, returns the overall placement.",
            schema(
                List.of("tournamentId", "teamId"),
                tournamentIdProperty(),
                property("teamId", "string", "Team identifier (school name or team number)"),
                property(
                    "event",
                    "string",
                    "Event name (e.g., \"Bridge Building\"). If omitted, returns the overall"
                        + " placement.")),
            "get team placement",
            args ->
                tools.teamPlacement(
                    string(args, "tournamentId"), string(args, "teamId"), string(args, "event"))));
    specs.add(
        tool(
            "get_tournament_rankings",
            "Get complete tournament rankings with scoring rules (ties, drops, penalties) applied",
            schema(
                List.of("tournamentId"),
                tournamentIdProperty(),
                property(
                    "limit",
                    "number",
                    "Optional limit on number of teams to return (default: all teams)")),
            "get tournament rankings",
            args ->
                tools.tournamentRankings(string(args, "tournamentId"), integer(args, "limit"))));
    specs.add(
        tool(
            "list_tournaments",
            "List all available tournaments for autocomplete and discovery",
            schema(List.of()),
            "list tournaments",
            args -> tools.listTournaments()));
    specs.add(
        tool(
            "get_tournament_info",
            "Get tournament information including teams and events for autocomplete",
            schema(List.of("tournamentId"), tournamentIdProperty()),
            "get tournament info",
            args -> tools.tournamentInfo(string(args, "tournamentId"))));
    specs.add(
        tool(
            "get_tournament_teams",
            "Get detailed list of all teams in a tournament with numbers, names, locations, and"
                + " suffixes",
            schema(List.of("tournamentId"), tournamentIdProperty()),
            "get tournament teams",
            args -> tools.tournamentTeams(string(args, "tournamentId"))));
    specs.add(
        tool(
            "get_team_all_placements",
            "Get all event placements for a specific team, including dropped events",
            schema(
                List.of("tournamentId", "teamId"),
                tournamentIdProperty(),
                property("teamId", "string", "Team identifier (school name or team number)")),
            "get team all placements",
            args -> tools.teamAllPlacements(string(args, "tournamentId"), string(args, "teamId"))));
    specs.add(
        tool(
            "search",
            "Search for tournaments and teams across the duosmium dataset",
            schema(
                List.of("query"),
                property(
                    "query",
                    "string",
                    "Search query (e.g., team name, school, location, tournament name)"),
                property("type", "string", "Type of search: tournament, team, or both"),
                property("limit", "number", "Maximum number of results to return (default: 10)")),
            "search",
            args ->
                tools.search(string(args, "query"), string(args, "type"), integer(args, "limit"))));
    specs.add(
        tool(
            "fetch",
            "Retrieve Duosmium data and return the contents as JSON",
            schema(List.of("id"), property("id", "string", "Tournament Duosmium ID")),
            "fetch tournament data",
            args -> tools.fetch(string(args, "id"))));
    return specs;
  }

  private static McpServerFeatures.SyncToolSpecification tool(
      String name,
      String description,
      McpSchema.JsonSchema inputSchema,
      String action,
      Function<Map<String, Object>, String> handler) {
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(name)
                .description(description)
                .inputSchema(inputSchema)
                .build())
        .callHandler(
            (exchange, request) -> {
              Map<String, Object> args =
                  Objects.requireNonNullElse(request.arguments(), Collections.emptyMap());
              return new McpSchema.CallToolResult(invoke(name, action, handler, args), false);
            })
        .build();
  }

  /** Runs a tool and converts failures into protocol errors. */
  static String invoke(
      String name,
      String action,
      Function<Map<String, Object>, String> handler,
      Map<String, Object> args) {
    try {
      log.debug("Tool {} called with {}", name, args);
      return handler.apply(args);
    } catch (ValidationException e) {
      log.debug("Rejected {} call: {}", name, e.getMessage());
      throw protocolError(McpSchema.ErrorCodes.INVALID_PARAMS, e.getMessage());
    } catch (McpError e) {
      throw e;
    } catch (Exception e) {
      log.error("Failed to handle tool {}", name, e);
      throw protocolError(
          McpSchema.ErrorCodes.INTERNAL_ERROR,
          "Failed to %s: %s".formatted(action, ExceptionUtil.describe(e)));
    }
  }

  private static List<McpServerFeatures.SyncResourceSpecification> resources(
      ResultsToolService tools) {
    List<McpServerFeatures.SyncResourceSpecification> specs = new ArrayList<>();
    for (String id : tools.tournamentIds()) {
      McpSchema.Resource resource =
          McpSchema.Resource.builder()
              .uri(ResultsToolService.RESOURCE_PREFIX + id)
              .name("Science Olympiad Results - " + id)
              .description("Results for tournament: " + id)
              .mimeType(YAML_MIME)
              .build();
      specs.add(
          new McpServerFeatures.SyncResourceSpecification(
              resource, (exchange, request) -> readResource(tools, request.uri())));
    }
    return specs;
  }

  private static McpServerFeatures.SyncResourceTemplateSpecification resourceTemplate(
      ResultsToolService tools) {
    return new McpServerFeatures.SyncResourceTemplateSpecification(
        McpSchema.ResourceTemplate.builder()
            .uriTemplate(ResultsToolService.RESOURCE_PREFIX + "{id}")
            .name("Science Olympiad Results")
            .description(
                "Access Science Olympiad results by ID. Replace {id} with the specific result"
                    + " identifier.")
            .mimeType(YAML_MIME)
            .build(),
        (exchange, request) -> readResource(tools, request.uri()));
  }

  static McpSchema.ReadResourceResult readResource(ResultsToolService tools, String uri) {
    try {
      String content = tools.readResource(uri);
      return new McpSchema.ReadResourceResult(
          List.of(new McpSchema.TextResourceContents(uri, YAML_MIME, content)));
    } catch (ValidationException e) {
      throw protocolError(McpSchema.ErrorCodes.INVALID_REQUEST, e.getMessage());
    } catch (NotFoundException e) {
      throw protocolError(
          McpSchema.ErrorCodes.INVALID_REQUEST,
          "Resource not found: " + uri.substring(ResultsToolService.RESOURCE_PREFIX.length()));
    } catch (Exception e) {
      log.error("Failed to read resource {}", uri, e);
      throw protocolError(
          McpSchema.ErrorCodes.INTERNAL_ERROR,
          "Failed to read resource: " + ExceptionUtil.describe(e));
    }
  }

  static McpError protocolError(int code, String message) {
    return new McpError(new McpSchema.JSONRPCResponse.JSONRPCError(code, message, null));
  }

  @SafeVarargs
  private static McpSchema.JsonSchema schema(
      List<String> required, Map.Entry<String, Object>... properties) {
    Map<String, Object> props = new LinkedHashMap<>();
    for (Map.Entry<String, Object> p : properties) {
      props.put(p.getKey(), p.getValue());
    }
    return new McpSchema.JsonSchema(
        "object", props, required, false, Collections.emptyMap(), Collections.emptyMap());
  }

  private static Map.Entry<String, Object> tournamentIdProperty() {
    return property(
        "tournamentId",
        "string",
        "Tournament ID (e.g., \"1989-03-10_sCA_orange_county_regional_b\")");
  }

  private static Map.Entry<String, Object> property(String name, String type, String description) {
    return Map.entry(name, Map.of("type", type, "description", description));
  }

  static String string(Map<String, Object> args, String name) {
    Object value = args.get(name);
    return value == null ? null : value.toString();
  }

  /** Integer argument; JSON numbers may arrive as any {@link Number} or as numeric text. */
  static Integer integer(Map<String, Object> args, String name) {
    Object value = args.get(name);
    if (value == null) return null;
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (d != Math.rint(d)) {
        throw new ValidationException(
            "Argument '%s' must be an integer: %s".formatted(name, value));
      }
      return number.intValue();
    }
    String text = value.toString().trim();
    if (text.isEmpty()) return null;
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new ValidationException("Argument '%s' must be an integer: %s".formatted(name, value));
    }
  }

  @Override
  public void close() {
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
    mcpServer = null;
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
