package com.gentoro.duosmium.store;

import com.gentoro.duosmium.exception.IoException;
import com.gentoro.duosmium.exception.NotFoundException;
import com.gentoro.duosmium.exception.NotFoundException.EntityKind;
import com.gentoro.duosmium.exception.ValidationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only access to the results directory: one YAML file per tournament under {@code
 * <root>/data/results}, the tournament id being the file name without extension.
 */
public class ResultsStore {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(ResultsStore.class);

  private static final String EXTENSION = ".yaml";
  private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

  private final Path resultsDir;

  public ResultsStore(Path dataRoot) {
    this.resultsDir = dataRoot.resolve("data").resolve("results");
  }

  public Path resultsDir() {
    return resultsDir;
  }

  /** Tournament ids, sorted lexicographically. An unreadable directory yields an empty list. */
  public List<String> listIds() {
    if (!Files.isDirectory(resultsDir)) {
      log.error("Results directory {} does not exist", resultsDir);
      return Collections.emptyList();
    }
    try (Stream<Path> files = Files.list(resultsDir)) {
      return files
          .map(p -> p.getFileName().toString())
          .filter(name -> name.endsWith(EXTENSION))
          .map(name -> name.substring(0, name.length() - EXTENSION.length()))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      log.error("Error reading tournaments directory {}", resultsDir, e);
      return Collections.emptyList();
    }
  }

  public boolean exists(String id) {
    return Files.isRegularFile(path(id));
  }

  /** Raw record content, verbatim. */
  public String read(String id) {
    Path file = path(id);
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      throw notFound(id, e);
    } catch (IOException e) {
      throw new IoException("Failed to read tournament '%s'".formatted(id), e);
    }
  }

  /** Modification time of the record in epoch milliseconds, used as its version. */
  public long version(String id) {
    Path file = path(id);
    try {
      return Files.getLastModifiedTime(file).toMillis();
    } catch (NoSuchFileException e) {
      throw notFound(id, e);
    } catch (IOException e) {
      throw new IoException("Failed to stat tournament '%s'".formatted(id), e);
    }
  }

  /**
   * File of a tournament. Ids are restricted to file-name characters so that a caller cannot
   * escape the results directory.
   */
  public Path path(String id) {
    if (id == null || !VALID_ID.matcher(id).matches()) {
      throw new ValidationException("Invalid tournament id: " + id);
    }
    return resultsDir.resolve(id + EXTENSION);
  }

  private static NotFoundException notFound(String id, Throwable cause) {
    return new NotFoundException(
        EntityKind.TOURNAMENT, "Tournament \"%s\" not found".formatted(id), cause);
  }
}
