package vessel.watchlist.error.exception;

import vessel.watchlist.error.CommonErrorCode;
import vessel.watchlist.error.exception.base.ServerBaseException;

/** 정합성 계산 Executor 포화로 작업이 거절됨 (503, 재시도 가능) */
public class ReconciliationRejectedException extends ServerBaseException {

  public ReconciliationRejectedException(String executorName, Throwable cause) {
    super(CommonErrorCode.RECONCILIATION_REJECTED, cause, executorName);
  }
}
