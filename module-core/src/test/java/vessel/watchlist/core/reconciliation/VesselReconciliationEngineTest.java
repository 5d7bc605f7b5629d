package vessel.watchlist.core.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static vessel.watchlist.core.reconciliation.VesselFixtures.BLUE;
import static vessel.watchlist.core.reconciliation.VesselFixtures.GREEN;
import static vessel.watchlist.core.reconciliation.VesselFixtures.RED;
import static vessel.watchlist.core.reconciliation.VesselFixtures.vessel;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import vessel.watchlist.core.domain.model.ConflictGroup;
import vessel.watchlist.core.domain.model.ConflictReport;
import vessel.watchlist.core.domain.model.ReconciliationResult;
import vessel.watchlist.core.domain.model.VesselRecord;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;

@DisplayName("VesselReconciliationEngine")
class VesselReconciliationEngineTest {

  private final ExecutorService pool = Executors.newFixedThreadPool(3);

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  @DisplayName("빈 저장소는 오류가 아니라 0건 결과")
  void emptySnapshot_yieldsZeroTotals() {
    ReconciliationResult result =
        new VesselReconciliationEngine(Runnable::run).reconcile(WatchlistSnapshot.empty());

    assertThat(result.conflicts().totalConflicts()).isZero();
    assertThat(result.conflicts().mmsiDuplicates()).isEmpty();
    assertThat(result.conflicts().imoDuplicates()).isEmpty();
    assertThat(result.conflicts().inconsistencies()).isEmpty();
    assertThat(result.aggregation().totalUniqueVessels()).isZero();
    assertThat(result.aggregation().vessels()).isEmpty();
  }

  @Test
  @DisplayName("병렬 패스 결과는 동기 실행 결과와 같다")
  void parallelPasses_matchSequentialExecution() {
    WatchlistSnapshot snapshot = mixedSnapshot();

    ReconciliationResult sequential =
        new VesselReconciliationEngine(Runnable::run).reconcile(snapshot);
    ReconciliationResult parallel = new VesselReconciliationEngine(pool).reconcile(snapshot);

    assertThat(parallel).isEqualTo(sequential);
  }

  @Test
  @DisplayName("total_conflicts는 세 범주의 합이고 영향 리스트는 처음 등장 순서")
  void totalConflicts_andAffectedLists() {
    ConflictReport conflicts =
        new VesselReconciliationEngine(pool).reconcile(mixedSnapshot()).conflicts();

    assertThat(conflicts.mmsiDuplicates()).hasSize(1);
    assertThat(conflicts.imoDuplicates()).hasSize(1);
    assertThat(conflicts.inconsistencies()).hasSize(1);
    assertThat(conflicts.totalConflicts()).isEqualTo(3);
    assertThat(conflicts.affectedListIds()).containsExactly(1L, 2L, 3L);
  }

  @Test
  @DisplayName("패스 하나가 실패하면 부분 결과 없이 원인 예외가 전파된다")
  void failingPass_abortsWholeComputation() {
    ConflictDetector broken =
        new ConflictDetector() {
          @Override
          public List<ConflictGroup> detectImoDuplicates(IdentityIndex index) {
            throw new IllegalStateException("imo pass failed");
          }
        };
    VesselReconciliationEngine engine =
        new VesselReconciliationEngine(
            new IdentityIndexer(),
            broken,
            new AggregationEngine(),
            new WatchlistStatsCalculator(),
            pool);

    assertThatThrownBy(() -> engine.reconcile(mixedSnapshot()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("imo pass failed");
  }

  private static WatchlistSnapshot mixedSnapshot() {
    return VesselFixtures.snapshot(
        List.<VesselRecord>of(
            vessel(1, "123456789", null, RED),
            vessel(2, "123456789", null, BLUE),
            vessel(3, null, "9876543", BLUE),
            vessel(4, "", "9876543", GREEN),
            vessel(5, "111111111", "1234567", GREEN),
            vessel(6, "111111111", "7654321", GREEN)));
  }
}
