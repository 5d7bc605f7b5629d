package vessel.watchlist.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import vessel.watchlist.core.domain.model.ReconciliationResult;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;

/**
 * 정합성 계산 결과 L1 캐시 (Caffeine)
 *
 * <h3>키 = 스냅샷 내용</h3>
 *
 * <ul>
 *   <li>호출자는 매 요청마다 저장소에서 스냅샷을 읽고, 그 스냅샷 자체를 키로 조회합니다.
 *   <li>스냅샷은 값 동등성(record)을 가지므로 어느 경로로 쓰기가 일어나든 내용이 바뀌면 키가 달라집니다. 무효화 이벤트에 의존하지 않습니다.
 *   <li>같은 스냅샷에 대한 동시 요청은 Caffeine의 키 단위 계산으로 한 번만 계산
 * </ul>
 *
 * <p>캐시는 파이프라인 계산만 생략하며 저장소 조회는 생략하지 않습니다. 비활성화 시 매 요청마다 직접 계산합니다.
 */
@Slf4j
public class ReconciliationResultCache {

  private final boolean enabled;
  private final Cache<WatchlistSnapshot, ReconciliationResult> cache;

  public ReconciliationResultCache(boolean enabled, Duration ttl, long maximumSize) {
    this.enabled = enabled;
    this.cache =
        Caffeine.newBuilder()
            .expireAfterWrite(Objects.requireNonNull(ttl, "ttl"))
            .maximumSize(maximumSize)
            .build();
  }

  /**
   * 스냅샷에 대한 결과를 반환하고, 없으면 pipeline으로 계산하여 저장
   *
   * @param snapshot 이번 요청에서 저장소로부터 읽은 스냅샷
   * @param pipeline 스냅샷 → 정합성 결과
   * @return 결과와 캐시 적중 여부
   */
  public Lookup getOrCompute(
      WatchlistSnapshot snapshot, Function<WatchlistSnapshot, ReconciliationResult> pipeline) {
    Objects.requireNonNull(snapshot, "snapshot");
    if (!enabled) {
      return new Lookup(pipeline.apply(snapshot), false);
    }
    AtomicBoolean computed = new AtomicBoolean(false);
    ReconciliationResult result =
        cache.get(
            snapshot,
            key -> {
              computed.set(true);
              return pipeline.apply(key);
            });
    if (computed.get()) {
      log.debug(
          "[ReconciliationCache] stored result for snapshot (lists={}, vessels={})",
          snapshot.lists().size(),
          snapshot.vessels().size());
    }
    return new Lookup(result, !computed.get());
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** 캐시 조회 결과 */
  public record Lookup(ReconciliationResult result, boolean hit) {}
}
