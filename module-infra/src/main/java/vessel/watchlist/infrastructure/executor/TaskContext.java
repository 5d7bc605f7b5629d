package vessel.watchlist.infrastructure.executor;

import java.util.Objects;

/**
 * 로그/메트릭용 작업 컨텍스트
 *
 * <h3>형식</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("VesselRecordStore", "fetchSnapshot")
 *   → "VesselRecordStore:fetchSnapshot"
 * - TaskContext.of("Reconciliation", "compute", "v3")
 *   → "Reconciliation:compute:v3"
 * </pre>
 *
 * <p>component, operation은 고정 값이고 dynamicValue는 로그에만 기록합니다.
 *
 * @param component 컴포넌트 이름
 * @param operation 작업 유형
 * @param dynamicValue 동적 값 (없으면 빈 문자열)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
