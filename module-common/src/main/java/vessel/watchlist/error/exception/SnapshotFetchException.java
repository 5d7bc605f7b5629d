package vessel.watchlist.error.exception;

import vessel.watchlist.error.CommonErrorCode;
import vessel.watchlist.error.exception.base.ServerBaseException;

/**
 * 워치리스트 스냅샷 조회 실패
 *
 * <p>스냅샷은 단일 일관 읽기로만 가져오므로, 조회가 실패하면 부분 리포트 없이 계산 전체를 중단합니다.
 */
public class SnapshotFetchException extends ServerBaseException {

  public SnapshotFetchException(String detail) {
    super(CommonErrorCode.SNAPSHOT_FETCH_FAILED, detail);
  }

  public SnapshotFetchException(String detail, Throwable cause) {
    super(CommonErrorCode.SNAPSHOT_FETCH_FAILED, cause, detail);
  }
}
