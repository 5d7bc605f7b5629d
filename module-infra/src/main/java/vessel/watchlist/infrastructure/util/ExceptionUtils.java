package vessel.watchlist.infrastructure.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** 비동기 래퍼 예외(CompletionException, ExecutionException)에서 원인 예외를 꺼내는 유틸리티 */
public class ExceptionUtils {

  /**
   * 래퍼 예외를 벗겨 원인 예외를 반환
   *
   * @param throwable 원본 예외
   * @return 원인 예외 (래핑되지 않았거나 원인이 없으면 원본)
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = cause.getCause();
      if (cause == null) {
        return throwable;
      }
    }
    return cause;
  }

  private ExceptionUtils() {}
}
