package com.gentoro.duosmium;

import com.gentoro.duosmium.cache.InterpretationCache;
import com.gentoro.duosmium.results.interpreter.Interpretation;
import com.gentoro.duosmium.results.interpreter.Interpreter;
import com.gentoro.duosmium.results.loader.RecordLoader;
import com.gentoro.duosmium.store.ResultsStore;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/** Access to the sample records under {@code src/test/resources/fixtures}. */
public final class Fixtures {
  public static final String DEMO = "demo-2024";
  public static final String ORANGE_COUNTY = "1989-03-10_sCA_orange_county_regional_b";
  public static final String TROY = "2023-02-04_troy_invitational_c";
  public static final String NATIONALS = "2019-06-01_nationals_c";

  private Fixtures() {}

  public static Path dataRoot() {
    URL url = Fixtures.class.getResource("/fixtures");
    if (url == null) throw new IllegalStateException("fixtures not on the test classpath");
    try {
      return Path.of(url.toURI());
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  public static ResultsStore store() {
    return new ResultsStore(dataRoot());
  }

  public static InterpretationCache cache(ResultsStore store) {
    return new InterpretationCache(
        store, new RecordLoader(), new Interpreter(), true, 64, Duration.ofMinutes(5));
  }

  public static Interpretation interpret(String id) {
    ResultsStore store = store();
    return new Interpreter().interpret(new RecordLoader().load(id, store.read(id)));
  }

  /** Interprets an inline YAML record. */
  public static Interpretation interpretYaml(String id, String yaml) {
    return new Interpreter().interpret(new RecordLoader().load(id, yaml));
  }
}
