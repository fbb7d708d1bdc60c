package com.gentoro.duosmium.results.model;

/**
 * One placing as written in the record, before interpretation. References its team and event by
 * key; the interpreter resolves them.
 *
 * @param place explicit place, {@code null} when the record carries a raw score instead
 * @param rawScore raw event score, {@code null} when the record carries an explicit place
 */
public record PlacingRecord(
    String eventName,
    int teamNumber,
    Integer place,
    Double rawScore,
    boolean participated,
    boolean disqualified) {}
