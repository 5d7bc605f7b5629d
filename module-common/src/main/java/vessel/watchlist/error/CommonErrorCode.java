package vessel.watchlist.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  SNAPSHOT_FETCH_FAILED(
      "S002", "워치리스트 스냅샷 조회 실패 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  RECONCILIATION_TIMEOUT(
      "S003", "선박 식별자 정합성 계산 시간 초과 (제한: %sms)", HttpStatus.SERVICE_UNAVAILABLE),
  RECONCILIATION_REJECTED(
      "S004", "정합성 계산 대기열이 가득 찼습니다 (%s)", HttpStatus.SERVICE_UNAVAILABLE);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
