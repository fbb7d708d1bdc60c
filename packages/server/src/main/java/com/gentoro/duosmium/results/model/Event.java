package com.gentoro.duosmium.results.model;

/**
 * An event of the tournament. Trial flags are carried for display only.
 *
 * @param lowestWins whether raw scores rank ascending ({@code scoring: lowest})
 */
public record Event(String name, boolean trial, boolean trialed, boolean lowestWins) {}
