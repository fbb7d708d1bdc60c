package com.gentoro.duosmium.results.interpreter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CompetitionRankingTest {

  @Test
  @DisplayName("Equal keys share a rank and the next rank skips the tie group")
  void standardCompetitionRanking() {
    List<CompetitionRanking.Ranked<String>> ranked =
        CompetitionRanking.rank(List.of("d:7", "a:3", "b:5", "c:5", "e:5", "f:9"), RANKING_KEY);

    assertThat(ranked.stream().map(r -> r.item() + "=" + r.rank()).collect(Collectors.toList()))
        .containsExactly("a:3=1", "b:5=2", "c:5=2", "e:5=2", "d:7=5", "f:9=6");
    assertThat(ranked.stream().filter(CompetitionRanking.Ranked::tie).count()).isEqualTo(3);
  }

  @Test
  @DisplayName("An empty pool yields no ranks")
  void emptyPool() {
    assertThat(CompetitionRanking.rank(List.<String>of(), RANKING_KEY)).isEmpty();
  }

  @Test
  @DisplayName("Isolated ranks count strictly better pool keys and flag equal ones")
  void isolated() {
    double[] pool = CompetitionRanking.keys(List.of(4.0, 1.0, 4.0, 11.0));

    assertThat(CompetitionRanking.isolated(5, pool))
        .isEqualTo(new CompetitionRanking.Isolated(4, false));
    assertThat(CompetitionRanking.isolated(4, pool))
        .isEqualTo(new CompetitionRanking.Isolated(2, true));
    assertThat(CompetitionRanking.isolated(0, pool))
        .isEqualTo(new CompetitionRanking.Isolated(1, false));
    assertThat(CompetitionRanking.isolated(3, new double[0]))
        .isEqualTo(new CompetitionRanking.Isolated(1, false));
  }

  private static final java.util.function.ToDoubleFunction<String> RANKING_KEY =
      s -> Double.parseDouble(s.substring(s.indexOf(':') + 1));
}
