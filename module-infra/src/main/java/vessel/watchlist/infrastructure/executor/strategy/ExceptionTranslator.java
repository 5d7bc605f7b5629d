package vessel.watchlist.infrastructure.executor.strategy;

import java.util.concurrent.RejectedExecutionException;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import vessel.watchlist.error.exception.InternalSystemException;
import vessel.watchlist.error.exception.ReconciliationRejectedException;
import vessel.watchlist.error.exception.SnapshotFetchException;
import vessel.watchlist.error.exception.base.BaseException;
import vessel.watchlist.infrastructure.executor.TaskContext;
import vessel.watchlist.infrastructure.util.ExceptionUtils;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * 예외를 변환하여 반환
   *
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>이미 도메인 예외(BaseException)면 그대로 반환
   *   <li>나머지는 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 예외 변환기: 도메인 예외가 아니면 InternalSystemException */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /**
   * 스냅샷 조회 예외 변환기
   *
   * <p>저장소 접근 실패(DataAccessException)와 트랜잭션 시작/커밋 실패(TransactionException)를 {@link
   * SnapshotFetchException}(503)으로 변환합니다.
   */
  static ExceptionTranslator forSnapshotFetch() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof DataAccessException
              || unwrapped instanceof TransactionException) {
            return new SnapshotFetchException(
                context.toTaskName() + ": " + unwrapped.getMessage(), unwrapped);
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }

  /**
   * 정합성 파이프라인 예외 변환기
   *
   * <p>패스 Executor 포화(RejectedExecutionException)는 재시도 가능한 {@link ReconciliationRejectedException}으로,
   * 나머지는 InternalSystemException으로 변환합니다.
   */
  static ExceptionTranslator forReconciliation() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof RejectedExecutionException) {
            return new ReconciliationRejectedException(context.toTaskName(), unwrapped);
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }
}
