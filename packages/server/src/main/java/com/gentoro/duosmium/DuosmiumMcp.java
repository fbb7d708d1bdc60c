package com.gentoro.duosmium;

import com.gentoro.duosmium.actuator.HealthService;
import com.gentoro.duosmium.cache.InterpretationCache;
import com.gentoro.duosmium.exception.ConfigException;
import com.gentoro.duosmium.exception.DuosmiumException;
import com.gentoro.duosmium.exception.ExceptionUtil;
import com.gentoro.duosmium.exception.StateException;
import com.gentoro.duosmium.http.EmbeddedJettyServer;
import com.gentoro.duosmium.mcp.McpServer;
import com.gentoro.duosmium.results.interpreter.Interpretation;
import com.gentoro.duosmium.results.interpreter.Interpreter;
import com.gentoro.duosmium.results.loader.RecordLoader;
import com.gentoro.duosmium.search.SearchIndex;
import com.gentoro.duosmium.search.SearchIndexFactory;
import com.gentoro.duosmium.store.ResultsStore;
import com.gentoro.duosmium.tools.ResultsToolService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/** Application container: wires configuration, results services and the HTTP endpoints. */
public class DuosmiumMcp {

  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(DuosmiumMcp.class);

  static final String DEFAULT_RESULTS_BASE_URL = "https://www.duosmium.org/results";

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ResultsStore store;
  private InterpretationCache interpretations;
  private ExecutorService corpusExecutor;
  private SearchIndex searchIndex;
  private ResultsToolService toolService;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private int exitCode;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public DuosmiumMcp(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    if ("help".equals(startupParameters.mode())) {
      log.info(usage());
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.duosmium.logging.LoggingService.applyConfiguration(configuration());
    initializeServices();

    switch (startupParameters.mode()) {
      case "check":
        exitCode = check();
        shutdown();
        break;
      case "server":
        startHttp();
        break;
      default:
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  void initializeServices() {
    Configuration cfg = configuration();
    String dataRoot = ConfigurationProvider.resolvedString(cfg, "duosmium.path", null);
    if (dataRoot == null) {
      throw new ConfigException(
          "DUOSMIUM_PATH is not set; export it or add DUOSMIUM_PATH=/path/to/duosmium"
              + " to .env.local");
    }
    this.store = new ResultsStore(Path.of(dataRoot));
    if (!Files.isDirectory(store.resultsDir())) {
      log.warn(
          "Results directory {} does not exist; no tournaments will be listed",
          store.resultsDir());
    }

    this.interpretations =
        new InterpretationCache(
            store,
            new RecordLoader(),
            new Interpreter(),
            cfg.getBoolean("cache.enabled", true),
            cfg.getLong("cache.maximum-size", 512L),
            duration(cfg, "cache.expire-after-access", Duration.ofMinutes(30)));

    int parallelism =
        ConfigurationProvider.resolvedInt(
            cfg,
            "search.corpus.parallelism",
            Math.max(2, Runtime.getRuntime().availableProcessors()));
    this.corpusExecutor = Executors.newFixedThreadPool(parallelism, daemonThreads("corpus-loader"));
    this.searchIndex = SearchIndexFactory.create(cfg, store, interpretations, corpusExecutor);
    this.toolService =
        new ResultsToolService(
            store,
            interpretations,
            searchIndex,
            ConfigurationProvider.resolvedString(
                cfg, "results.base-url", DEFAULT_RESULTS_BASE_URL));
    log.info(
        "Results store at {} (cache {}, search source {})",
        store.resultsDir(),
        interpretations.enabled() ? "enabled" : "disabled",
        searchIndex.source().name());
  }

  private void startHttp() {
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new HealthService(this).register();
      this.mcpServer = new McpServer(this);
      mcpServer.register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new StateException("Could not start http server", ex));
    }
  }

  /** Loads and interprets every record; returns the number of records that failed. */
  int check() {
    List<String> ids = store.listIds();
    int failures = 0;
    int teams = 0;
    for (String id : ids) {
      try {
        Interpretation interpretation = interpretations.compute(id);
        teams += interpretation.teams().size();
      } catch (DuosmiumException e) {
        failures++;
        log.error("{}: {} ({})", id, e.getMessage(), e.getCode());
      }
    }
    log.info(
        "Checked {} tournaments ({} teams): {} valid, {} failed",
        ids.size(),
        teams,
        ids.size() - failures,
        failures);
    return failures;
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "duosmium-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (mcpServer != null) mcpServer.close();
        if (httpServer != null) httpServer.stop();
        if (corpusExecutor != null) corpusExecutor.shutdownNow();
      } catch (RuntimeException e) {
        log.warn("Error during shutdown", e);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public boolean isServerMode() {
    return "server".equals(startupParameters.mode());
  }

  public int exitCode() {
    return exitCode;
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("DuosmiumMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ResultsStore store() {
    return store;
  }

  public InterpretationCache interpretations() {
    return interpretations;
  }

  public SearchIndex searchIndex() {
    return searchIndex;
  }

  public ResultsToolService toolService() {
    return toolService;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  static Duration duration(Configuration cfg, String key, Duration defaultValue) {
    String value = ConfigurationProvider.resolvedString(cfg, key, null);
    if (value == null) return defaultValue;
    try {
      return Duration.parse(value);
    } catch (DateTimeParseException e) {
      throw new ConfigException(
          "Configuration key '%s' is not an ISO-8601 duration: %s".formatted(key, value), e);
    }
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  static String usage() {
    return String.join(
        "\n",
        "Usage: duosmium-mcp [--mode server|check|help] [--config-file <location>]",
        "  --mode server       serve MCP over HTTP (default)",
        "  --mode check        load and interpret every record, report failures and exit",
        "  --config-file       classpath:<res>, file:<uri> or a path",
        "                      (default classpath:application.yaml)",
        "Environment: DUOSMIUM_PATH (required), PORT (default 3000)");
  }
}
