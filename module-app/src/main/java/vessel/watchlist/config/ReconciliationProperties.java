package vessel.watchlist.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 선박 식별자 정합성 계산 설정
 *
 * <pre>
 * reconciliation:
 *   request-timeout: 10s
 *   cache:
 *     enabled: true
 *     ttl: 10m
 *     maximum-size: 2
 *   executor:
 *     pass-pool-size: 5
 *     request-pool-size: 4
 *     queue-capacity: 100
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

  /** 요청 하나의 계산 데드라인 (스냅샷 조회 포함) */
  @NotNull private Duration requestTimeout = Duration.ofSeconds(10);

  @Valid private final Cache cache = new Cache();

  @Valid private final Executor executor = new Executor();

  @Getter
  @Setter
  public static class Cache {

    private boolean enabled = true;

    @NotNull private Duration ttl = Duration.ofMinutes(10);

    @Min(1)
    private long maximumSize = 2;
  }

  @Getter
  @Setter
  public static class Executor {

    /** 독립 패스 5개를 동시에 돌릴 수 있는 크기 */
    @Min(1)
    private int passPoolSize = 5;

    @Min(1)
    private int requestPoolSize = 4;

    @Min(0)
    private int queueCapacity = 100;
  }
}
