package vessel.watchlist.config;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/**
 * MDC 전파용 TaskDecorator 생성
 *
 * <p>HTTP 요청 진입 시 {@link vessel.watchlist.global.filter.MDCFilter}가 넣은 requestId를 비동기 워커 스레드까지
 * 전달합니다.
 *
 * <ol>
 *   <li>호출 스레드에서 MDC.getCopyOfContextMap() 캡처
 *   <li>워커 스레드 진입 시 캡처한 맵으로 교체
 *   <li>작업 완료 후 finally에서 워커의 원래 맵으로 복원
 * </ol>
 */
public class TaskDecoratorFactory {

  public TaskDecorator createMdcPropagatingDecorator() {
    return runnable -> {
      Map<String, String> captured = MDC.getCopyOfContextMap();

      return () -> {
        Map<String, String> before = MDC.getCopyOfContextMap();
        replaceMdc(captured);
        try {
          runnable.run();
        } finally {
          replaceMdc(before);
        }
      };
    };
  }

  private static void replaceMdc(Map<String, String> contextMap) {
    if (contextMap != null) {
      MDC.setContextMap(contextMap);
    } else {
      MDC.clear();
    }
  }
}
