package com.gentoro.duosmium.results.query;

import com.gentoro.duosmium.exception.NotFoundException;
import com.gentoro.duosmium.exception.NotFoundException.EntityKind;
import com.gentoro.duosmium.results.model.Team;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a caller-supplied team reference.
 *
 * <ol>
 *   <li>An integer reference is looked up as a team number.
 *   <li>Otherwise (or when no team has that number) the reference is compared, ignoring case,
 *       with each team's school name and its name with suffix. Candidates are tiered: exact name,
 *       then prefix, then substring. Within the best tier the earliest team in record order wins.
 * </ol>
 *
 * <p>Known limitation: a substring shared by several schools ("High") picks the first of them,
 * which may not be the team the caller meant. Callers that need certainty should pass the number.
 */
public class TeamResolver {

  private final List<Team> teams;

  public TeamResolver(List<Team> teams) {
    this.teams = List.copyOf(teams);
  }

  public Team resolve(String reference) {
    return find(reference)
        .orElseThrow(
            () ->
                new NotFoundException(
                    EntityKind.TEAM, "Team \"%s\" not found".formatted(reference)));
  }

  public Optional<Team> find(String reference) {
    if (reference == null || reference.isBlank()) return Optional.empty();
    String ref = reference.trim();

    Optional<Team> byNumber = byNumber(ref);
    if (byNumber.isPresent()) return byNumber;

    String needle = ref.toLowerCase(Locale.ROOT);
    Team best = null;
    int bestTier = Integer.MAX_VALUE;
    for (Team team : teams) {
      int tier = Math.min(tier(needle, team.school()), tier(needle, team.displayName()));
      if (tier < bestTier) {
        best = team;
        bestTier = tier;
      }
    }
    return Optional.ofNullable(best);
  }

  private Optional<Team> byNumber(String ref) {
    int number;
    try {
      number = Integer.parseInt(ref.startsWith("#") ? ref.substring(1) : ref);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    return teams.stream().filter(t -> t.number() == number).findFirst();
  }

  /** 0 = exact, 1 = prefix, 2 = substring, MAX = no match. */
  private static int tier(String needle, String name) {
    if (name == null) return Integer.MAX_VALUE;
    String hay = name.toLowerCase(Locale.ROOT);
    if (hay.equals(needle)) return 0;
    if (hay.startsWith(needle)) return 1;
    if (hay.contains(needle)) return 2;
    return Integer.MAX_VALUE;
  }
}
