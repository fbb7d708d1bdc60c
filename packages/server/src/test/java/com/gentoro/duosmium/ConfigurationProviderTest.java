package com.gentoro.duosmium;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.gentoro.duosmium.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  @DisplayName("Loads the bundled application.yaml from the classpath")
  void classpathDefaults() {
    Configuration cfg = new ConfigurationProvider("classpath:application.yaml").config();
    assertEquals("corpus", cfg.getString("search.source"));
    assertEquals("0.0.0.0", ConfigurationProvider.resolvedString(cfg, "http.hostname", null));
    assertEquals("/mcp", ConfigurationProvider.resolvedString(cfg, "http.mcp.endpoint", null));
  }

  @Test
  @DisplayName("A missing classpath resource yields an empty configuration")
  void missingClasspathResource() {
    Configuration cfg = new ConfigurationProvider("classpath:does-not-exist.yaml").config();
    assertEquals("fallback", ConfigurationProvider.resolvedString(cfg, "any.key", "fallback"));
  }

  @Test
  @DisplayName("Loads YAML from a file path and a file URI")
  void fileLocations(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("local.yaml");
    Files.writeString(file, "duosmium:\n  path: /data/duosmium\nhttp:\n  port: 8123\n");

    Configuration byPath = new ConfigurationProvider(file.toString()).config();
    assertEquals("/data/duosmium", byPath.getString("duosmium.path"));

    Configuration byUri = new ConfigurationProvider(file.toUri().toString()).config();
    assertEquals(8123, ConfigurationProvider.resolvedInt(byUri, "http.port", 3000));
  }

  @Test
  @DisplayName("A missing file is a configuration error")
  void missingFile(@TempDir Path dir) {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
  }

  @Test
  @DisplayName("Blank and unresolved values fall back to the default")
  void resolvedValues() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("blank", "  ");
    cfg.setProperty("placeholder", "${env:SOME_UNSET_VARIABLE}");
    cfg.setProperty("port", " 4000 ");
    cfg.setProperty("bad", "forty");

    assertNull(ConfigurationProvider.resolvedString(cfg, "blank", null));
    assertNull(ConfigurationProvider.resolvedString(cfg, "placeholder", null));
    assertEquals("d", ConfigurationProvider.resolvedString(cfg, "missing", "d"));
    assertEquals(4000, ConfigurationProvider.resolvedInt(cfg, "port", 1));
    assertEquals(1, ConfigurationProvider.resolvedInt(cfg, "missing", 1));
    assertThrows(ConfigException.class, () -> ConfigurationProvider.resolvedInt(cfg, "bad", 1));
  }
}
