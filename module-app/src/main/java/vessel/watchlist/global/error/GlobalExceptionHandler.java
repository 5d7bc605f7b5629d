package vessel.watchlist.global.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import vessel.watchlist.error.CommonErrorCode;
import vessel.watchlist.error.dto.ErrorResponse;
import vessel.watchlist.error.exception.base.BaseException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** 도메인 예외: 가공된 메시지(예: 어떤 조회가 실패했는지)를 그대로 응답 */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return ResponseEntity.status(e.getErrorCode().getStatus()).body(ErrorResponse.from(e));
  }

  /** 예측하지 못한 예외: 스택 트레이스는 로그에만 남기고 응답은 공통 코드로 */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ResponseEntity.status(CommonErrorCode.INTERNAL_SERVER_ERROR.getStatus())
        .body(ErrorResponse.from(CommonErrorCode.INTERNAL_SERVER_ERROR));
  }
}
