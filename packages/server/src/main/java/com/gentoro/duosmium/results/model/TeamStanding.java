package com.gentoro.duosmium.results.model;

/**
 * Overall result of a team.
 *
 * @param rank rank number; exhibition teams carry the rank they would have had without taking a
 *     slot
 * @param tie whether another team in the same pool has the same rank
 */
public record TeamStanding(Team team, int points, int rank, boolean tie) {

  public boolean official() {
    return team.official();
  }
}
