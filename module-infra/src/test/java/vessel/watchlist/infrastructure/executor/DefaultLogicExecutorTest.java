package vessel.watchlist.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import vessel.watchlist.error.exception.InternalSystemException;
import vessel.watchlist.error.exception.SnapshotFetchException;
import vessel.watchlist.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Unit tests for {@link DefaultLogicExecutor}.
 *
 * <ul>
 *   <li>execute() - result pass-through and default translation
 *   <li>executeWithTranslation() - snapshot fetch translator
 *   <li>slow task WARN logging
 * </ul>
 */
@DisplayName("DefaultLogicExecutor")
class DefaultLogicExecutorTest {

  private static final TaskContext CONTEXT = TaskContext.of("Test", "run");

  private final DefaultLogicExecutor executor = new DefaultLogicExecutor(200);

  @Nested
  @DisplayName("execute")
  class Execute {

    @Test
    @DisplayName("정상 결과는 그대로 반환")
    void returnsResult() {
      assertThat(executor.execute(() -> "ok", CONTEXT)).isEqualTo("ok");
    }

    @Test
    @DisplayName("체크 예외는 InternalSystemException으로 변환")
    void checkedException_isTranslated() {
      assertThatThrownBy(() -> executor.execute(DefaultLogicExecutorTest::failWithIo, CONTEXT))
          .isInstanceOf(InternalSystemException.class)
          .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("도메인 예외는 CompletionException을 벗겨 그대로 전파")
    void domainException_passesThroughUnwrapped() {
      SnapshotFetchException original = new SnapshotFetchException("db down");

      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new CompletionException(original);
                      },
                      CONTEXT))
          .isSameAs(original);
    }

    @Test
    @DisplayName("Error는 번역 없이 전파")
    void error_isRethrown() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new StackOverflowError();
                      },
                      CONTEXT))
          .isInstanceOf(StackOverflowError.class);
    }
  }

  @Nested
  @DisplayName("executeWithTranslation(forSnapshotFetch)")
  class SnapshotFetch {

    @Test
    @DisplayName("DataAccessException → SnapshotFetchException")
    void dataAccessFailure() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new DataAccessResourceFailureException("connection refused");
                      },
                      ExceptionTranslator.forSnapshotFetch(),
                      TaskContext.of("VesselRecordStore", "fetchSnapshot")))
          .isInstanceOf(SnapshotFetchException.class)
          .hasMessageContaining("VesselRecordStore:fetchSnapshot")
          .hasMessageContaining("connection refused");
    }

    @Test
    @DisplayName("트랜잭션 시작 실패 → SnapshotFetchException")
    void transactionFailure() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new CannotCreateTransactionException("no connection");
                      },
                      ExceptionTranslator.forSnapshotFetch(),
                      CONTEXT))
          .isInstanceOf(SnapshotFetchException.class);
    }

    @Test
    @DisplayName("저장소와 무관한 예외는 InternalSystemException")
    void otherFailure() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new IllegalArgumentException("bug");
                      },
                      ExceptionTranslator.forSnapshotFetch(),
                      CONTEXT))
          .isInstanceOf(InternalSystemException.class)
          .hasCauseInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("slow task 로그")
  class SlowTaskLogging {

    private final Logger logger = (Logger) LoggerFactory.getLogger(DefaultLogicExecutor.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
      appender.start();
      logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
      logger.detachAppender(appender);
    }

    @Test
    @DisplayName("임계값 이상 걸린 작업은 WARN으로 기록")
    void slowTask_isLoggedAtWarn() {
      DefaultLogicExecutor strict = new DefaultLogicExecutor(0);

      strict.execute(() -> "done", TaskContext.of("Reconciliation", "compute", "v1"));

      assertThat(appender.list)
          .anySatisfy(
              event -> {
                assertThat(event.getLevel()).isEqualTo(Level.WARN);
                assertThat(event.getFormattedMessage())
                    .contains("[SlowTask:Reconciliation:compute:v1]");
              });
    }
  }

  private static String failWithIo() throws IOException {
    throw new IOException("disk");
  }
}
