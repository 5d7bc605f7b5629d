package vessel.watchlist.config;

import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import vessel.watchlist.core.reconciliation.VesselReconciliationEngine;
import vessel.watchlist.infrastructure.cache.ReconciliationResultCache;

/**
 * 정합성 파이프라인 빈 구성
 *
 * <p>module-core의 엔진은 Spring에 의존하지 않으므로 여기서 Executor를 주입해 조립합니다.
 */
@Slf4j
@Configuration
public class ReconciliationConfig {

  @Bean
  public VesselReconciliationEngine vesselReconciliationEngine(
      @Qualifier("reconciliationPassExecutor") Executor passExecutor) {
    return new VesselReconciliationEngine(passExecutor);
  }

  @Bean
  public ReconciliationResultCache reconciliationResultCache(ReconciliationProperties props) {
    ReconciliationProperties.Cache cache = props.getCache();
    log.info(
        "[ReconciliationCache] enabled={}, ttl={}, maximumSize={}",
        cache.isEnabled(),
        cache.getTtl(),
        cache.getMaximumSize());
    return new ReconciliationResultCache(
        cache.isEnabled(), cache.getTtl(), cache.getMaximumSize());
  }
}
