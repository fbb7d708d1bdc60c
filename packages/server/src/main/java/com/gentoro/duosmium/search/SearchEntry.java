package com.gentoro.duosmium.search;

/**
 * One searchable item.
 *
 * @param id identifier shown to the caller (tournament id, {@code tournamentId:teamNumber}, or a
 *     school label)
 * @param name primary key matched with the higher weight
 * @param details human-readable context, not matched
 * @param searchableText secondary key: name, locations, identifiers and keywords concatenated
 */
public record SearchEntry(
    EntryKind kind, String id, String name, String details, String searchableText) {}
