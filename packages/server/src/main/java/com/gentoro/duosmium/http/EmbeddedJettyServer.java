package com.gentoro.duosmium.http;

import com.gentoro.duosmium.ConfigurationProvider;
import com.gentoro.duosmium.exception.ConfigException;
import com.gentoro.duosmium.exception.ExceptionUtil;
import com.gentoro.duosmium.exception.NetworkException;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle (prepare/start/stop/join) and exposes the context handler so the MCP
 * transport and the health probe can register their servlets before {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  static final int DEFAULT_PORT = 3000;
  static final String ANY_HOST = "0.0.0.0";

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Create the server and root context without opening the listener. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port = configuredPort();
      String hostname;
      try {
        hostname = ConfigurationProvider.resolvedString(configuration, "http.hostname", ANY_HOST);
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }
      log.trace("Preparing Jetty on {}:{}", hostname, port);

      try {
        Server created = new Server();
        ServerConnector connector = new ServerConnector(created);
        if (!ANY_HOST.equals(hostname)) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        created.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        created.setHandler(contextHandler);
        server = created;
      } catch (Exception e) {
        throw new NetworkException(
            "Failed to initialize the HTTP listener on %s:%d".formatted(hostname, port), e);
      }
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        log.info("Starting Jetty on port {}...", configuredPort());
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "Failed to start the HTTP listener; check that port %d is free"
                        .formatted(configuredPort()),
                    ex));
      }
    }
  }

  /** Stops the server. Failures are logged so that other services can still shut down. */
  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      try {
        if (server.isRunning() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping Jetty", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started (useful with {@code http.port: 0}), the configured one otherwise. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return configuredPort();
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  private int configuredPort() {
    return ConfigurationProvider.resolvedInt(configuration, "http.port", DEFAULT_PORT);
  }

  @Override
  public void close() {
    stop();
  }
}
