package vessel.watchlist.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Executor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import vessel.watchlist.infrastructure.executor.DefaultLogicExecutor;
import vessel.watchlist.infrastructure.executor.LogicExecutor;

/**
 * Executor Configuration - LogicExecutor 및 정합성 계산 Thread Pool 설정
 *
 * <h4>Thread Pool 분리</h4>
 *
 * <ul>
 *   <li><b>reconciliationRequestExecutor</b>: 요청 단위 작업 (스냅샷 조회 + 패스 join)
 *   <li><b>reconciliationPassExecutor</b>: 인덱스 이후의 독립 패스 5개
 * </ul>
 *
 * <p>요청 작업이 패스 완료를 기다리며 스레드를 점유하므로 두 작업을 한 풀에 넣으면 포화 시 교착됩니다.
 */
@Configuration
@EnableConfigurationProperties(ExecutorLoggingProperties.class)
public class ExecutorConfig {

  private final MeterRegistry meterRegistry;

  public ExecutorConfig(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  // ==================== LogicExecutor Bean ====================

  @Bean
  public LogicExecutor logicExecutor(ExecutorLoggingProperties props) {
    return new DefaultLogicExecutor(props.getSlowMs());
  }

  @Bean
  public TaskDecorator mdcPropagatingDecorator() {
    return new TaskDecoratorFactory().createMdcPropagatingDecorator();
  }

  // ==================== ThreadPoolTaskExecutor Beans ====================

  @Bean(name = "reconciliationRequestExecutor")
  public Executor reconciliationRequestExecutor(
      ReconciliationProperties props, TaskDecorator mdcPropagatingDecorator) {
    ReconciliationProperties.Executor pool = props.getExecutor();
    return buildPool(
        "reconcile-req-",
        "reconciliation.request",
        pool.getRequestPoolSize(),
        pool.getQueueCapacity(),
        mdcPropagatingDecorator);
  }

  /**
   * 패스 전용 Executor
   *
   * <p>패스는 요청 Executor에서만 제출되므로 큐 크기는 요청 수 x 패스 수를 감당하도록 잡습니다.
   */
  @Bean(name = "reconciliationPassExecutor")
  public Executor reconciliationPassExecutor(
      ReconciliationProperties props, TaskDecorator mdcPropagatingDecorator) {
    ReconciliationProperties.Executor pool = props.getExecutor();
    return buildPool(
        "reconcile-pass-",
        "reconciliation.pass",
        pool.getPassPoolSize(),
        pool.getRequestPoolSize() * pool.getPassPoolSize(),
        mdcPropagatingDecorator);
  }

  private ThreadPoolTaskExecutor buildPool(
      String threadPrefix,
      String metricName,
      int poolSize,
      int queueCapacity,
      TaskDecorator decorator) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix(threadPrefix);
    executor.setAllowCoreThreadTimeOut(true);
    executor.setKeepAliveSeconds(30);
    executor.setTaskDecorator(decorator);
    executor.setRejectedExecutionHandler(rejectionPolicyFactory().createAbortPolicy(metricName));

    // 진행 중인 계산은 끝까지 수행 (읽기 전용이므로 최대 30초)
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);

    executor.initialize();
    executorMetricsConfigurator().registerExecutorMetrics(executor, metricName);
    return executor;
  }

  // ==================== Helper Factory Beans ====================

  @Bean
  public RejectionPolicyFactory rejectionPolicyFactory() {
    return new RejectionPolicyFactory(meterRegistry);
  }

  @Bean
  public ExecutorMetricsConfigurator executorMetricsConfigurator() {
    return new ExecutorMetricsConfigurator(meterRegistry);
  }
}
