package com.gentoro.duosmium.search;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Canonical form shared by queries and entry texts: lower case, accents and punctuation removed,
 * whitespace collapsed, and casual words mapped to the words records use ("team" becomes
 * "school", "invite" becomes "invitational").
 */
public class QueryNormalizer {

  private static final Map<String, String> SYNONYMS =
      Map.ofEntries(
          Map.entry("team", "school"),
          Map.entry("teams", "school"),
          Map.entry("schools", "school"),
          Map.entry("hs", "high school"),
          Map.entry("ms", "middle school"),
          Map.entry("invite", "invitational"),
          Map.entry("invy", "invitational"),
          Map.entry("invitationals", "invitational"),
          Map.entry("regionals", "regional"),
          Map.entry("states", "state"),
          Map.entry("nats", "national"),
          Map.entry("nationals", "national"));

  public String normalize(String text) {
    if (text == null) return "";
    String folded =
        Normalizer.normalize(text, Normalizer.Form.NFD)
            .replaceAll("\\p{M}+", "")
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}]+", " ")
            .trim();
    if (folded.isEmpty()) return "";
    return Arrays.stream(folded.split(" "))
        .map(token -> SYNONYMS.getOrDefault(token, token))
        .collect(Collectors.joining(" "));
  }
}
