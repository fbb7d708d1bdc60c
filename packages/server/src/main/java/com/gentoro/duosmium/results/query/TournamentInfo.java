package com.gentoro.duosmium.results.query;

import java.util.List;

/** Summary of a tournament: title, team labels and event names, both in record order. */
public record TournamentInfo(
    String title, int teamCount, List<String> teams, List<String> events) {}
