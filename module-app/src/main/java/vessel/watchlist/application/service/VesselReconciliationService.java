package vessel.watchlist.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import vessel.watchlist.config.ReconciliationProperties;
import vessel.watchlist.core.domain.model.ReconciliationResult;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;
import vessel.watchlist.core.port.out.VesselRecordStore;
import vessel.watchlist.core.reconciliation.VesselReconciliationEngine;
import vessel.watchlist.error.exception.InternalSystemException;
import vessel.watchlist.error.exception.ReconciliationRejectedException;
import vessel.watchlist.error.exception.ReconciliationTimeoutException;
import vessel.watchlist.error.exception.base.BaseException;
import vessel.watchlist.infrastructure.cache.ReconciliationResultCache;
import vessel.watchlist.infrastructure.executor.LogicExecutor;
import vessel.watchlist.infrastructure.executor.TaskContext;
import vessel.watchlist.infrastructure.executor.strategy.ExceptionTranslator;
import vessel.watchlist.infrastructure.util.ExceptionUtils;

/**
 * 선박 식별자 정합성 Application Service
 *
 * <h3>요청 흐름</h3>
 *
 * <ol>
 *   <li>요청 Executor에서 단일 일관 읽기로 스냅샷 조회 (매 요청, 요청 데드라인 안에서)
 *   <li>스냅샷 내용을 키로 캐시 조회. miss면 엔진의 병렬 패스 실행 후 저장
 *   <li>{@code reconciliation.request-timeout} 초과 시 503
 * </ol>
 *
 * <p>저장소를 매번 읽으므로 외부 쓰기 경로의 변경도 다음 요청에 바로 반영됩니다. 타임아웃은 응답만 끝내고 진행 중인 계산을 취소하지 않습니다.
 */
@Slf4j
@Service
public class VesselReconciliationService {

  private static final String COMPONENT = "Reconciliation";
  private static final String REQUEST_EXECUTOR = "reconciliationRequestExecutor";

  private final VesselRecordStore store;
  private final VesselReconciliationEngine engine;
  private final ReconciliationResultCache cache;
  private final LogicExecutor executor;
  private final Executor requestExecutor;
  private final ReconciliationProperties properties;
  private final MeterRegistry meterRegistry;
  private final Counter orphanedCounter;

  public VesselReconciliationService(
      VesselRecordStore store,
      VesselReconciliationEngine engine,
      ReconciliationResultCache cache,
      LogicExecutor executor,
      @Qualifier(REQUEST_EXECUTOR) Executor requestExecutor,
      ReconciliationProperties properties,
      MeterRegistry meterRegistry) {
    this.store = store;
    this.engine = engine;
    this.cache = cache;
    this.executor = executor;
    this.requestExecutor = requestExecutor;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.orphanedCounter =
        Counter.builder("reconciliation.orphaned.records")
            .description("Vessel records referencing a non-existent watchlist")
            .register(meterRegistry);
  }

  /**
   * 현재 스냅샷에 대한 정합성 결과 (비동기)
   *
   * @return 충돌/집계/통계가 모두 담긴 결과. 실패 시 도메인 예외로 완료
   */
  public CompletableFuture<ReconciliationResult> reconcileAsync() {
    long timeoutMs = properties.getRequestTimeout().toMillis();
    CompletableFuture<ReconciliationResult> future;
    try {
      future = CompletableFuture.supplyAsync(this::reconcileWithCache, requestExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new ReconciliationRejectedException(REQUEST_EXECUTOR, e));
    }
    return future
        .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
        .exceptionally(
            e -> {
              throw translateFailure(e, timeoutMs);
            });
  }

  private ReconciliationResult reconcileWithCache() {
    WatchlistSnapshot snapshot =
        executor.executeWithTranslation(
            store::fetchSnapshot,
            ExceptionTranslator.forSnapshotFetch(),
            TaskContext.of(COMPONENT, "fetchSnapshot"));
    Timer.Sample sample = Timer.start(meterRegistry);
    ReconciliationResultCache.Lookup lookup = cache.getOrCompute(snapshot, this::computeFresh);
    sample.stop(
        Timer.builder("reconciliation.compute")
            .tag("cache", lookup.hit() ? "hit" : "miss")
            .register(meterRegistry));
    return lookup.result();
  }

  private ReconciliationResult computeFresh(WatchlistSnapshot snapshot) {
    ReconciliationResult result =
        executor.executeWithTranslation(
            () -> engine.reconcile(snapshot),
            ExceptionTranslator.forReconciliation(),
            TaskContext.of(COMPONENT, "compute", "vessels=" + snapshot.vessels().size()));
    reportOrphans(result.aggregation().orphanedVesselIds());
    log.info(
        "[Reconciliation] computed: totalConflicts={}, uniqueVessels={}",
        result.conflicts().totalConflicts(),
        result.aggregation().totalUniqueVessels());
    return result;
  }

  private void reportOrphans(List<Long> orphanedVesselIds) {
    if (orphanedVesselIds.isEmpty()) {
      return;
    }
    orphanedCounter.increment(orphanedVesselIds.size());
    log.warn(
        "[Reconciliation] {} vessel record(s) reference a missing watchlist: ids={}",
        orphanedVesselIds.size(),
        orphanedVesselIds);
  }

  private static RuntimeException translateFailure(Throwable e, long timeoutMs) {
    Throwable cause = ExceptionUtils.unwrapAsyncException(e);
    if (cause instanceof TimeoutException) {
      return new ReconciliationTimeoutException(timeoutMs, cause);
    }
    if (cause instanceof BaseException be) {
      return be;
    }
    if (cause instanceof RejectedExecutionException) {
      return new ReconciliationRejectedException(REQUEST_EXECUTOR, cause);
    }
    return new InternalSystemException(COMPONENT + ":reconcileAsync", cause);
  }
}
