package vessel.watchlist.error.exception;

import vessel.watchlist.error.CommonErrorCode;
import vessel.watchlist.error.exception.base.ServerBaseException;

public class ReconciliationTimeoutException extends ServerBaseException {

  public ReconciliationTimeoutException(long timeoutMillis, Throwable cause) {
    super(CommonErrorCode.RECONCILIATION_TIMEOUT, cause, timeoutMillis);
  }
}
