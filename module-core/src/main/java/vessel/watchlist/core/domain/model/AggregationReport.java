package vessel.watchlist.core.domain.model;

import java.util.List;

/**
 * 집계 패스 결과
 *
 * @param vessels MMSI별 집계 선박 (list_count 내림차순, 동률은 처음 등장한 순서)
 * @param orphanedVesselIds 존재하지 않는 list_id를 참조하여 lists에서 제외된 레코드 ID
 */
public record AggregationReport(List<AggregatedVessel> vessels, List<Long> orphanedVesselIds) {

  public AggregationReport {
    vessels = List.copyOf(vessels);
    orphanedVesselIds = List.copyOf(orphanedVesselIds);
  }

  public int totalUniqueVessels() {
    return vessels.size();
  }
}
