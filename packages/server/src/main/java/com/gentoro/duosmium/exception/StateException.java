package com.gentoro.duosmium.exception;

/** Component used before it was initialized, or after it was shut down. */
public class StateException extends DuosmiumException {
  public StateException(String message) {
    super(DuosmiumErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(DuosmiumErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
