package vessel.watchlist.core.reconciliation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import vessel.watchlist.core.domain.model.AggregationReport;
import vessel.watchlist.core.domain.model.ConflictGroup;
import vessel.watchlist.core.domain.model.ConflictReport;
import vessel.watchlist.core.domain.model.InconsistencyGroup;
import vessel.watchlist.core.domain.model.ReconciliationResult;
import vessel.watchlist.core.domain.model.WatchlistMetadata;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;
import vessel.watchlist.core.domain.model.WatchlistStats;

/**
 * 선박 식별자 정합성 파이프라인
 *
 * <pre>
 * Snapshot → IdentityIndexer → ┬ MMSI 중복 ┐
 *                              ├ IMO 중복  │
 *                              ├ 불일치    ├ join → ReconciliationResult
 *                              ├ 집계      │
 *                              └ 통계      ┘
 * </pre>
 *
 * <p>인덱스 생성 이후의 5개 패스는 서로의 출력에 의존하지 않고 읽기 전용 인덱스만 소비하므로, 주어진 {@link Executor}에서 동기화 없이
 * 병렬로 실행합니다. 상태를 보관하지 않으므로 인스턴스는 스레드 안전합니다.
 */
public class VesselReconciliationEngine {

  private final IdentityIndexer indexer;
  private final ConflictDetector conflictDetector;
  private final AggregationEngine aggregationEngine;
  private final WatchlistStatsCalculator statsCalculator;
  private final Executor passExecutor;

  public VesselReconciliationEngine(Executor passExecutor) {
    this(
        new IdentityIndexer(),
        new ConflictDetector(),
        new AggregationEngine(),
        new WatchlistStatsCalculator(),
        passExecutor);
  }

  public VesselReconciliationEngine(
      IdentityIndexer indexer,
      ConflictDetector conflictDetector,
      AggregationEngine aggregationEngine,
      WatchlistStatsCalculator statsCalculator,
      Executor passExecutor) {
    this.indexer = Objects.requireNonNull(indexer, "indexer");
    this.conflictDetector = Objects.requireNonNull(conflictDetector, "conflictDetector");
    this.aggregationEngine = Objects.requireNonNull(aggregationEngine, "aggregationEngine");
    this.statsCalculator = Objects.requireNonNull(statsCalculator, "statsCalculator");
    this.passExecutor = Objects.requireNonNull(passExecutor, "passExecutor");
  }

  public ReconciliationResult reconcile(WatchlistSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    IdentityIndex index = indexer.index(snapshot.vessels());
    Map<Long, WatchlistMetadata> listsById = snapshot.listsById();

    CompletableFuture<List<ConflictGroup>> mmsiDuplicates =
        submit(() -> conflictDetector.detectMmsiDuplicates(index));
    CompletableFuture<List<ConflictGroup>> imoDuplicates =
        submit(() -> conflictDetector.detectImoDuplicates(index));
    CompletableFuture<List<InconsistencyGroup>> inconsistencies =
        submit(() -> conflictDetector.detectInconsistencies(index));
    CompletableFuture<AggregationReport> aggregation =
        submit(() -> aggregationEngine.aggregate(index, listsById));
    CompletableFuture<WatchlistStats> stats = submit(() -> statsCalculator.calculate(snapshot));

    joinAll(mmsiDuplicates, imoDuplicates, inconsistencies, aggregation, stats);

    ConflictReport conflicts =
        new ConflictReport(mmsiDuplicates.join(), imoDuplicates.join(), inconsistencies.join());
    return new ReconciliationResult(snapshot, conflicts, aggregation.join(), stats.join());
  }

  private <T> CompletableFuture<T> submit(Supplier<T> pass) {
    return CompletableFuture.supplyAsync(pass, passExecutor);
  }

  /** 패스 실패 시 CompletionException을 벗겨 원인 예외를 그대로 전파 (부분 결과 없음) */
  private static void joinAll(CompletableFuture<?>... passes) {
    try {
      CompletableFuture.allOf(passes).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      if (e.getCause() instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }
}
