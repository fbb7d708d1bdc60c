package com.gentoro.duosmium.exception;

/** An external catalog could not be fetched (HTTP error, timeout, unreachable host). */
public class FetchException extends DuosmiumException {
  public FetchException(String message) {
    super(DuosmiumErrorCode.FETCH_ERROR, message);
  }

  public FetchException(String message, Throwable cause) {
    super(DuosmiumErrorCode.FETCH_ERROR, message, cause);
  }
}
