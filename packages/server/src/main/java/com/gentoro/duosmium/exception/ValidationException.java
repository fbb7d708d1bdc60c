package com.gentoro.duosmium.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends DuosmiumException {
  public ValidationException(String message) {
    super(DuosmiumErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(DuosmiumErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
