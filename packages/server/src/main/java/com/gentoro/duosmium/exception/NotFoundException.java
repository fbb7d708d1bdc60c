package com.gentoro.duosmium.exception;

import java.util.Map;

/** Requested tournament, team, event or placement does not exist. */
public class NotFoundException extends DuosmiumException {

  /** What kind of entity could not be found. */
  public enum EntityKind {
    TOURNAMENT,
    TEAM,
    EVENT,
    PLACEMENT
  }

  private final EntityKind kind;

  public NotFoundException(EntityKind kind, String message) {
    super(DuosmiumErrorCode.NOT_FOUND, message, Map.of("kind", kind));
    this.kind = kind;
  }

  public NotFoundException(EntityKind kind, String message, Throwable cause) {
    super(DuosmiumErrorCode.NOT_FOUND, message, Map.of("kind", kind), cause);
    this.kind = kind;
  }

  public EntityKind getKind() {
    return kind;
  }
}
