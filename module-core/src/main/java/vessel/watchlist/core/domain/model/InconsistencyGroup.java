package vessel.watchlist.core.domain.model;

import java.util.List;

/**
 * 하나의 MMSI가 서로 다른 IMO 값 2개 이상과 짝지어진 불일치 그룹
 *
 * @param mmsi 불일치가 발견된 MMSI
 * @param imos 서로 다른 비어있지 않은 IMO 값 (처음 등장한 순서)
 * @param vessels 그 MMSI의 모든 레코드. IMO가 없는 레코드 포함 (스냅샷 순서)
 */
public record InconsistencyGroup(String mmsi, List<String> imos, List<VesselRecord> vessels) {

  public InconsistencyGroup {
    imos = List.copyOf(imos);
    vessels = List.copyOf(vessels);
  }
}
