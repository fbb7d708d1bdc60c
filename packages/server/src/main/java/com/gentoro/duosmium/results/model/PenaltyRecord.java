package com.gentoro.duosmium.results.model;

/** Penalty points added to a team's total. */
public record PenaltyRecord(int teamNumber, int points) {}
