package vessel.watchlist.infrastructure.executor;

import vessel.watchlist.infrastructure.executor.function.ThrowingSupplier;
import vessel.watchlist.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code this::method})로 넘깁니다. 실행 시간과 실패는 {@link TaskContext}
 * 이름으로 기록됩니다.
 *
 * <h3>사용 예시</h3>
 *
 * <pre>{@code
 * return executor.executeWithTranslation(
 *     this::readSnapshot,
 *     ExceptionTranslator.forSnapshotFetch(),
 *     TaskContext.of("VesselRecordStore", "fetchSnapshot"));
 * }</pre>
 */
public interface LogicExecutor {

  /**
   * 예외를 기본 변환기로 변환하여 전파
   *
   * @param task 실행할 작업
   * @param context 작업 컨텍스트
   * @return 작업 결과
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /**
   * 지정한 변환기로 예외를 변환하여 전파
   *
   * @param task 실행할 작업
   * @param translator 예외 변환기
   * @param context 작업 컨텍스트
   * @return 작업 결과
   */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
