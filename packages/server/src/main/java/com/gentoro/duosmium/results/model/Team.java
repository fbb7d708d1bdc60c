package com.gentoro.duosmium.results.model;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/** A team entered in one tournament, identified by its number. */
public record Team(
    int number,
    String school,
    String schoolAbbreviation,
    String suffix,
    String subdivision,
    String city,
    String state,
    boolean disqualified,
    boolean exhibition) {

  /** Teams that count towards official rankings. */
  public boolean official() {
    return !disqualified && !exhibition;
  }

  /** "City, ST" from whichever parts are present; empty when neither is. */
  public String location() {
    return Stream.of(city, state)
        .filter(s -> s != null && !s.isBlank())
        .collect(Collectors.joining(", "));
  }

  /** School name followed by the suffix used to tell apart teams of the same school. */
  public String displayName() {
    return suffix == null || suffix.isBlank() ? school : school + " " + suffix;
  }
}
