package vessel.watchlist.infrastructure.executor;

import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import vessel.watchlist.infrastructure.executor.function.ThrowingSupplier;
import vessel.watchlist.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 기본 LogicExecutor 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>Slow task 로그</b>: {@code executor.logging.slow-ms} 이상 걸린 작업은 WARN
 *   <li><b>번역기 실패 격리</b>: 번역기가 던진 예외는 원본을 suppressed로 붙여 전파
 * </ul>
 */
@Slf4j
public class DefaultLogicExecutor implements LogicExecutor {

  private final long slowThresholdMs;

  public DefaultLogicExecutor(long slowThresholdMs) {
    this.slowThresholdMs = slowThresholdMs;
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, ExceptionTranslator.defaultTranslator(), context);
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(translator, "translator");
    Objects.requireNonNull(context, "context");

    long startNanos = System.nanoTime();
    try {
      T result = task.get();
      logElapsed(context, startNanos);
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      log.debug("[Task:{}] failed: {}", context.toTaskName(), t.toString());
      throw translateSafe(translator, t, context);
    }
  }

  private void logElapsed(TaskContext context, long startNanos) {
    long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
    if (elapsedMs >= slowThresholdMs) {
      log.warn(
          "[SlowTask:{}] {}ms (threshold {}ms)",
          context.toTaskName(),
          elapsedMs,
          slowThresholdMs);
      return;
    }
    log.debug("[Task:{}] {}ms", context.toTaskName(), elapsedMs);
  }

  private static RuntimeException translateSafe(
      ExceptionTranslator translator, Throwable original, TaskContext context) {
    try {
      RuntimeException translated = translator.translate(original, context);
      if (translated == null) {
        return new IllegalStateException(
            "Translator returned null [" + context.toTaskName() + "]", original);
      }
      return translated;
    } catch (RuntimeException translatorFailure) {
      if (translatorFailure != original) {
        translatorFailure.addSuppressed(original);
      }
      return translatorFailure;
    }
  }
}
