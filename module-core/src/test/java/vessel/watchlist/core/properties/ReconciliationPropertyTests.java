package vessel.watchlist.core.properties;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import vessel.watchlist.core.domain.model.ConflictGroup;
import vessel.watchlist.core.domain.model.InconsistencyGroup;
import vessel.watchlist.core.domain.model.ReconciliationResult;
import vessel.watchlist.core.domain.model.VesselRecord;
import vessel.watchlist.core.domain.model.WatchlistMetadata;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;
import vessel.watchlist.core.reconciliation.VesselReconciliationEngine;

/**
 * 정합성 파이프라인 불변식(Property-Based) 테스트
 *
 * <h3>검증하는 불변식</h3>
 *
 * <ol>
 *   <li>total_conflicts = 세 범주 그룹 수의 합
 *   <li>MMSI 중복 그룹은 서로 다른 리스트 2개 이상을 포함
 *   <li>하나의 MMSI는 최대 하나의 MMSI 중복 그룹, 최대 하나의 불일치 그룹에만 등장
 *   <li>같은 스냅샷 = 같은 결과 (멱등성)
 *   <li>집계 선박 수 = 스냅샷 내 서로 다른 MMSI 수
 * </ol>
 *
 * <p>식별자 풀을 작게 잡아 충돌이 자주 발생하도록 생성합니다.
 */
class ReconciliationPropertyTests {

  private final VesselReconciliationEngine engine = new VesselReconciliationEngine(Runnable::run);

  @Property(tries = 200)
  void total_conflicts_is_sum_of_categories(@ForAll("snapshots") WatchlistSnapshot snapshot) {
    var conflicts = engine.reconcile(snapshot).conflicts();

    assertThat(conflicts.totalConflicts())
        .isEqualTo(
            conflicts.mmsiDuplicates().size()
                + conflicts.imoDuplicates().size()
                + conflicts.inconsistencies().size());
  }

  @Property(tries = 200)
  void mmsi_duplicate_groups_span_at_least_two_lists(
      @ForAll("snapshots") WatchlistSnapshot snapshot) {
    for (ConflictGroup group : engine.reconcile(snapshot).conflicts().mmsiDuplicates()) {
      Set<Long> lists =
          group.vessels().stream().map(VesselRecord::listId).collect(Collectors.toSet());
      assertThat(lists).hasSizeGreaterThanOrEqualTo(2);
      assertThat(group.count()).isEqualTo(lists.size());
    }
  }

  @Property(tries = 200)
  void each_mmsi_appears_in_at_most_one_duplicate_group(
      @ForAll("snapshots") WatchlistSnapshot snapshot) {
    Set<String> seen = new HashSet<>();
    for (ConflictGroup group : engine.reconcile(snapshot).conflicts().mmsiDuplicates()) {
      assertThat(seen.add(group.key())).isTrue();
    }
  }

  @Property(tries = 200)
  void each_mmsi_appears_in_at_most_one_inconsistency_group(
      @ForAll("snapshots") WatchlistSnapshot snapshot) {
    Set<String> seen = new HashSet<>();
    for (InconsistencyGroup group : engine.reconcile(snapshot).conflicts().inconsistencies()) {
      assertThat(seen.add(group.mmsi())).isTrue();
      assertThat(group.imos()).doesNotHaveDuplicates().hasSizeGreaterThanOrEqualTo(2);
      assertThat(group.vessels()).allMatch(vessel -> group.mmsi().equals(vessel.mmsi()));
    }
  }

  @Property(tries = 100)
  void reconciliation_is_idempotent(@ForAll("snapshots") WatchlistSnapshot snapshot) {
    ReconciliationResult first = engine.reconcile(snapshot);
    ReconciliationResult second = engine.reconcile(snapshot);

    assertThat(second).isEqualTo(first);
  }

  @Property(tries = 200)
  void aggregation_covers_every_distinct_mmsi(@ForAll("snapshots") WatchlistSnapshot snapshot) {
    long distinctMmsi =
        snapshot.vessels().stream()
            .filter(VesselRecord::hasMmsi)
            .map(VesselRecord::mmsi)
            .distinct()
            .count();

    assertThat(engine.reconcile(snapshot).aggregation().totalUniqueVessels())
        .isEqualTo((int) distinctMmsi);
  }

  // ============================================================
  // Arbitraries
  // ============================================================

  @Provide
  Arbitrary<WatchlistSnapshot> snapshots() {
    Arbitrary<String> mmsi =
        Arbitraries.of("", "111111111", "222222222", "333333333").injectNull(0.2);
    Arbitrary<String> imo = Arbitraries.of("", "1234567", "7654321").injectNull(0.3);
    Arbitrary<Long> listId = Arbitraries.longs().between(1L, 4L);
    Arbitrary<VesselRecord> record =
        Combinators.combine(mmsi, imo, listId)
            .as((m, i, l) -> VesselRecord.of(0L, m, i, l));

    return record
        .list()
        .ofMaxSize(30)
        .map(
            records -> {
              List<VesselRecord> numbered = new ArrayList<>(records.size());
              for (int i = 0; i < records.size(); i++) {
                VesselRecord r = records.get(i);
                numbered.add(VesselRecord.of((long) i + 1, r.mmsi(), r.imo(), r.listId()));
              }
              return new WatchlistSnapshot(lists(), numbered);
            });
  }

  private static List<WatchlistMetadata> lists() {
    return List.of(
        new WatchlistMetadata(1L, "Red", "#ff0000"),
        new WatchlistMetadata(2L, "Blue", "#0000ff"),
        new WatchlistMetadata(3L, "Green", "green"));
  }
}
