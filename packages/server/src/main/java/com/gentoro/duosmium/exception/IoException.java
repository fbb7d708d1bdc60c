package com.gentoro.duosmium.exception;

/** Local I/O failure (filesystem). */
public class IoException extends DuosmiumException {
  public IoException(String message, Throwable cause) {
    super(DuosmiumErrorCode.IO_ERROR, message, cause);
  }
}
