package com.gentoro.duosmium.results.model;

import java.util.Optional;

/**
 * Interpreted result of one team in one event.
 *
 * @param place 1-based place, or 0 when the team was disqualified or did not show up
 * @param tie whether another team shares the place
 * @param points points charged to the team (lower is better)
 * @param dropped whether the placement is excluded from the team total
 */
public record Placement(
    Team team,
    Event event,
    int place,
    boolean tie,
    int points,
    boolean dropped,
    boolean participated,
    boolean disqualified,
    Double rawScore) {

  public boolean disqualifiedOrNoShow() {
    return place == 0;
  }

  public Optional<Double> raw() {
    return Optional.ofNullable(rawScore);
  }

  /** Copy of this placement marked as dropped. */
  public Placement asDropped() {
    return new Placement(
        team, event, place, tie, points, true, participated, disqualified, rawScore);
  }
}
