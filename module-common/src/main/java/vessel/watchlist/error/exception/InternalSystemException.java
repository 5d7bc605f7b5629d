package vessel.watchlist.error.exception;

import vessel.watchlist.error.CommonErrorCode;
import vessel.watchlist.error.exception.base.ServerBaseException;

/** 분류되지 않은 기술적 예외를 감싸는 최후의 서버 예외 */
public class InternalSystemException extends ServerBaseException {

  private final String taskName;

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.taskName = taskName;
  }

  public String getTaskName() {
    return taskName;
  }
}
