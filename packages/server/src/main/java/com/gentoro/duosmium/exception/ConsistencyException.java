package com.gentoro.duosmium.exception;

/** Entities of one record reference each other inconsistently (e.g. an undeclared team). */
public class ConsistencyException extends DuosmiumException {
  public ConsistencyException(String message) {
    super(DuosmiumErrorCode.CONSISTENCY_ERROR, message);
  }
}
