package com.gentoro.duosmium.search;

/** What a search entry describes. Schools only come from the external catalog. */
public enum EntryKind {
  TOURNAMENT,
  TEAM,
  SCHOOL
}
