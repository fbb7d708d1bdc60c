package com.gentoro.duosmium.search;

/** A matched entry and its distance to the query; 0 is a perfect match. */
public record SearchResult(SearchEntry entry, double score) {}
