package vessel.watchlist.core.domain.model;

import java.util.List;

/**
 * 동일 키 값이 2개 이상의 서로 다른 리스트에 걸쳐 등장하는 충돌 그룹
 *
 * @param key MMSI 또는 IMO 값
 * @param kind 키 종류
 * @param vessels 해당 키를 가진 모든 레코드 (스냅샷 순서)
 * @param count 관련된 서로 다른 리스트의 수 (항상 2 이상)
 */
public record ConflictGroup(String key, IdentityKind kind, List<VesselRecord> vessels, int count) {

  public ConflictGroup {
    vessels = List.copyOf(vessels);
  }
}
