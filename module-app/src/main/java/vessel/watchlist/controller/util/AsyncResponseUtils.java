package vessel.watchlist.controller.util;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.springframework.http.ResponseEntity;

/**
 * 컨트롤러 비동기 응답 유틸리티
 *
 * <pre>{@code
 * return AsyncResponseUtils.map(service.conflictsAsync(), mapper::toConflictResponse);
 * }</pre>
 */
public final class AsyncResponseUtils {

  private AsyncResponseUtils() {}

  /** CompletableFuture 결과에 mapper를 적용하고 200 OK로 감싼다 */
  public static <T, R> CompletableFuture<ResponseEntity<R>> map(
      CompletableFuture<T> future, Function<T, R> mapper) {
    return future.thenApply(mapper).thenApply(ResponseEntity::ok);
  }
}
