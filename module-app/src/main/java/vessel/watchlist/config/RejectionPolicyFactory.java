package vessel.watchlist.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * 정합성 Executor용 AbortPolicy 생성
 *
 * <ul>
 *   <li><b>즉시 거부</b>: 큐 포화 시 톰캣 스레드에서 대신 실행하지 않음 (CallerRuns 금지)
 *   <li><b>503 응답</b>: 서비스가 ReconciliationRejectedException으로 변환
 *   <li><b>메트릭</b>: {@code executor.rejected{name=...}} Counter
 *   <li><b>Log storm 방지</b>: executor별로 1초에 1회만 WARN
 * </ul>
 */
@Slf4j
public class RejectionPolicyFactory {

  private static final long REJECT_LOG_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

  private final MeterRegistry meterRegistry;

  public RejectionPolicyFactory(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public RejectedExecutionHandler createAbortPolicy(String name) {
    Counter rejectedCounter =
        Counter.builder("executor.rejected")
            .tag("name", name)
            .description("Number of tasks rejected due to queue full")
            .register(meterRegistry);
    AtomicLong lastLogNanos = new AtomicLong(0);
    AtomicLong rejectedSinceLastLog = new AtomicLong(0);

    return (r, executor) -> {
      rejectedCounter.increment();

      if (executor.isShutdown() || executor.isTerminating()) {
        throw new RejectedExecutionException(name + " rejected (shutdown in progress)");
      }

      rejectedSinceLastLog.incrementAndGet();
      long now = System.nanoTime();
      long prev = lastLogNanos.get();
      if (now - prev >= REJECT_LOG_INTERVAL_NANOS && lastLogNanos.compareAndSet(prev, now)) {
        log.warn(
            "[{}] Task rejected (queue full). droppedInLastWindow={}, poolSize={}, "
                + "activeCount={}, queueSize={}",
            name,
            rejectedSinceLastLog.getAndSet(0),
            executor.getPoolSize(),
            executor.getActiveCount(),
            executor.getQueue().size());
      }

      throw new RejectedExecutionException(name + " queue full");
    };
  }
}
