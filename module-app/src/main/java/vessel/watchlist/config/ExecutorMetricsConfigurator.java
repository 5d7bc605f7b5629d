package vessel.watchlist.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor Micrometer 메트릭 등록 전담 클래스
 *
 * <ul>
 *   <li>{@code executor.completed} - 완료된 작업 수
 *   <li>{@code executor.active} - 현재 활성 스레드 수
 *   <li>{@code executor.queued} - 큐에 대기 중인 작업 수
 * </ul>
 */
@Slf4j
public class ExecutorMetricsConfigurator {

  private final MeterRegistry meterRegistry;

  public ExecutorMetricsConfigurator(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void registerExecutorMetrics(ThreadPoolTaskExecutor executor, String name) {
    new ExecutorServiceMetrics(executor.getThreadPoolExecutor(), name, Collections.emptyList())
        .bindTo(meterRegistry);
    log.info("[ExecutorMetrics] 등록 완료: name={}", name);
  }
}
