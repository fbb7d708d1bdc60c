package com.gentoro.duosmium;

import com.gentoro.duosmium.exception.ConfigException;
import com.gentoro.duosmium.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.ConfigurationInterpolator;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the application
 * classpath), "file:/etc/app.yaml", or a plain absolute/relative filesystem path. Values may
 * reference environment variables as {@code ${env:NAME}}; variables missing from the real
 * environment are looked up in a {@code .env.local} file.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(ConfigurationProvider.class);
  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  /**
   * Read a string value, treating blank values and unresolved {@code ${...}} placeholders as
   * absent.
   */
  public static String resolvedString(Configuration cfg, String key, String defaultValue) {
    String value = cfg.getString(key, null);
    if (value == null || value.isBlank() || value.trim().startsWith("${")) {
      return defaultValue;
    }
    return value.trim();
  }

  /** Integer counterpart of {@link #resolvedString(Configuration, String, String)}. */
  public static int resolvedInt(Configuration cfg, String key, int defaultValue) {
    String value = resolvedString(cfg, key, null);
    if (value == null) return defaultValue;
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigException(
          "Configuration key '%s' is not an integer: %s".formatted(key, value), e);
    }
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      // Fallback to empty YAML config if not found; defaults apply.
      return addOns(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return addOns(config);
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      log.info("Loading configuration from file: {}", file.getAbsolutePath());
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath("application.yaml");
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    try {
      URI uri = URI.create(loc);
      if (uri.getScheme() != null && uri.getScheme().equalsIgnoreCase("file")) {
        return loadYamlFromFile(new File(uri));
      }
    } catch (IllegalArgumentException ignored) {
      // not a URI, treat as a plain path
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(Configuration config) {
    ConfigurationInterpolator interpolator = config.getInterpolator();
    interpolator.registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  private static class FallbackEnvLookup implements Lookup {
    private volatile Map<String, String> fallback = null;

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }

      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            Path path = findEnvFile();
            if (path == null) {
              log.debug("No .env.local found, skipping environment variables fallback.");
              this.fallback = new HashMap<>();
            } else {
              this.fallback = readKeyValueFile(path);
            }
          }
        }
      }

      return fallback.get(key);
    }

    private Path findEnvFile() {
      Path p1 = Paths.get(".env.local");
      if (Files.exists(p1)) {
        return p1;
      }
      // Module-relative when running from repo root
      Path p2 = Paths.get("packages/server/.env.local");
      if (Files.exists(p2)) {
        return p2;
      }
      return null;
    }

    private Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading .env.local file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .filter(line -> !line.startsWith("#"))
            .map(this::parseLine)
            .filter(e -> !e.getKey().isEmpty())
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b));
      } catch (IOException e) {
        log.warn("Failed to read {}, ignoring it", path.toAbsolutePath(), e);
        return Collections.emptyMap();
      }
    }

    private Map.Entry<String, String> parseLine(String line) {
      int idx = line.indexOf('=');
      if (idx <= 0) return Map.entry("", "");
      String key = line.substring(0, idx).trim();
      String val = line.substring(idx + 1).trim();
      if ((val.startsWith("\"") && val.endsWith("\""))
          || (val.startsWith("'") && val.endsWith("'"))) {
        val = val.substring(1, val.length() - 1);
      }
      return Map.entry(key, val);
    }
  }
}
