package vessel.watchlist.core.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static vessel.watchlist.core.reconciliation.VesselFixtures.BLUE;
import static vessel.watchlist.core.reconciliation.VesselFixtures.GREEN;
import static vessel.watchlist.core.reconciliation.VesselFixtures.RED;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import vessel.watchlist.core.domain.model.VesselRecord;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;
import vessel.watchlist.core.domain.model.WatchlistStats;
import vessel.watchlist.core.domain.model.WatchlistStats.FlagCount;
import vessel.watchlist.core.domain.model.WatchlistStats.ListVesselCount;

@DisplayName("WatchlistStatsCalculator")
class WatchlistStatsCalculatorTest {

  private final WatchlistStatsCalculator calculator = new WatchlistStatsCalculator();

  @Test
  @DisplayName("리스트별 선박 수, 국적 분포, IMO/위치 보유 수를 계산한다")
  void calculatesOverview() {
    WatchlistSnapshot snapshot =
        VesselFixtures.snapshot(
            List.of(
                new VesselRecord(1L, "111111111", "1234567", "A", null, "PA", "1,2", null, 1L),
                new VesselRecord(2L, "222222222", null, "B", null, "LR", null, null, 1L),
                new VesselRecord(3L, "333333333", "", "C", null, "PA", "", null, 2L)));

    WatchlistStats stats = calculator.calculate(snapshot);

    assertThat(stats.totalLists()).isEqualTo(3);
    assertThat(stats.totalVessels()).isEqualTo(3);
    assertThat(stats.withImo()).isEqualTo(1);
    assertThat(stats.withoutImo()).isEqualTo(2);
    assertThat(stats.withPosition()).isEqualTo(1);
    assertThat(stats.uniqueFlags()).isEqualTo(2);
    assertThat(stats.flags()).containsExactly(new FlagCount("PA", 2), new FlagCount("LR", 1));
    assertThat(stats.lists())
        .containsExactly(
            new ListVesselCount(RED, 2),
            new ListVesselCount(BLUE, 1),
            new ListVesselCount(GREEN, 0));
  }

  @Test
  @DisplayName("빈 스냅샷은 0으로 채운 통계")
  void emptySnapshot() {
    WatchlistStats stats = calculator.calculate(WatchlistSnapshot.empty());

    assertThat(stats.totalLists()).isZero();
    assertThat(stats.totalVessels()).isZero();
    assertThat(stats.lists()).isEmpty();
    assertThat(stats.flags()).isEmpty();
  }
}
