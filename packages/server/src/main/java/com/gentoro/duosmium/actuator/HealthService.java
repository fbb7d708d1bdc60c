package com.gentoro.duosmium.actuator;

import com.gentoro.duosmium.ConfigurationProvider;
import com.gentoro.duosmium.DuosmiumMcp;
import com.gentoro.duosmium.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Liveness probe registered at {@code http.health.path} (default {@code /health}).
 *
 * <p>Response body: {@code {"status":"ok","service":"duosmium-mcp"}}
 */
public class HealthService {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(HealthService.class);

  static final String SERVICE_NAME = "duosmium-mcp";

  private final DuosmiumMcp app;

  public HealthService(DuosmiumMcp app) {
    this.app = app;
  }

  public void register() {
    String path =
        ConfigurationProvider.resolvedString(app.configuration(), "http.health.path", "/health");
    app.httpServer().getContextHandler().addServlet(new ServletHolder(new HealthServlet()), path);
    log.info("Health endpoint registered at {}", path);
  }

  static String payload() {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("status", "ok");
    body.put("service", SERVICE_NAME);
    return JacksonUtility.toCompactJson(body);
  }

  private static class HealthServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      resp.setCharacterEncoding("UTF-8");
      try (PrintWriter out = resp.getWriter()) {
        out.println(payload());
      }
    }
  }
}
