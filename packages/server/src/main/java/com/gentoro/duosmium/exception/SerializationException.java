package com.gentoro.duosmium.exception;

/** Serialization or deserialization failure. */
public class SerializationException extends DuosmiumException {
  public SerializationException(String message, Throwable cause) {
    super(DuosmiumErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
