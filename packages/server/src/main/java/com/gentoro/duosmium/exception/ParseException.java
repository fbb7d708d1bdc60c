package com.gentoro.duosmium.exception;

import java.util.Map;

/** A results record is malformed or misses a required field. */
public class ParseException extends DuosmiumException {
  public ParseException(String path, String problem) {
    super(
        DuosmiumErrorCode.PARSE_ERROR,
        "%s: %s".formatted(path, problem),
        Map.of("path", path));
  }

  public ParseException(String message, Throwable cause) {
    super(DuosmiumErrorCode.PARSE_ERROR, message, cause);
  }
}
