package com.gentoro.duosmium.search;

import java.util.List;

/** Supplies the entries a search runs over. */
public interface CorpusSource {

  /** Short name used in configuration and logs. */
  String name();

  /**
   * Entries of the requested kinds. Implementations decide how to treat partial failures; see the
   * implementing classes.
   */
  List<SearchEntry> entries(SearchType type);
}
