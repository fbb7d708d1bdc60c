package com.gentoro.duosmium.results.model;

import java.util.Arrays;
import java.util.Optional;

/** Tournament level as written in results records. */
public enum Level {
  INVITATIONAL("Invitational"),
  REGIONALS("Regionals"),
  STATES("States"),
  NATIONALS("Nationals");

  private final String label;

  Level(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** Exact match on the record label; anything else is not a known level. */
  public static Optional<Level> fromLabel(String label) {
    if (label == null) return Optional.empty();
    return Arrays.stream(values()).filter(l -> l.label.equals(label.trim())).findFirst();
  }
}
