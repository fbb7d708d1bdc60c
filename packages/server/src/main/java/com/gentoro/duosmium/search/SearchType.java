package com.gentoro.duosmium.search;

import com.gentoro.duosmium.exception.ValidationException;
import java.util.Locale;

/** Which entries a search call should consider. */
public enum SearchType {
  TOURNAMENT,
  TEAM,
  BOTH;

  public boolean includesTournaments() {
    return this != TEAM;
  }

  public boolean includesTeams() {
    return this != TOURNAMENT;
  }

  /** Lower-case name used in answers ("tournament", "team", "both"). */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses the caller's type argument. Blank means {@link #BOTH}; plural forms and "school" are
   * accepted as synonyms.
   */
  public static SearchType parse(String value) {
    if (value == null || value.isBlank()) return BOTH;
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "tournament":
      case "tournaments":
        return TOURNAMENT;
      case "team":
      case "teams":
      case "school":
      case "schools":
        return TEAM;
      case "both":
      case "all":
      case "any":
        return BOTH;
      default:
        throw new ValidationException(
            "Invalid search type '%s'; expected tournament, team or both".formatted(value));
    }
  }
}
