package com.gentoro.duosmium.exception;

/** The HTTP listener could not be created or started. */
public class NetworkException extends DuosmiumException {
  public NetworkException(String message, Throwable cause) {
    super(DuosmiumErrorCode.NETWORK_ERROR, message, cause);
  }
}
