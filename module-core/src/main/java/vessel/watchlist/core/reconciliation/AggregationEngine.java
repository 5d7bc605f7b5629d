package vessel.watchlist.core.reconciliation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import vessel.watchlist.core.domain.model.AggregatedVessel;
import vessel.watchlist.core.domain.model.AggregationReport;
import vessel.watchlist.core.domain.model.VesselRecord;
import vessel.watchlist.core.domain.model.WatchlistMetadata;

/**
 * MMSI 기준 선박 집계 엔진
 *
 * <h3>병합 규칙</h3>
 *
 * <ul>
 *   <li>MMSI 키 하나당 집계 선박 하나 (레코드가 1개인 키도 포함, list_count=1)
 *   <li>imo/name/flag: 스냅샷 순서상 처음으로 값이 있는 레코드의 값 (first non-empty wins)
 *   <li>lists: list_id 기준 중복 제거, 처음 등장한 순서
 *   <li>MMSI가 없는 레코드는 집계 키가 없으므로 제외 (합성 키를 만들지 않음)
 * </ul>
 *
 * <p>존재하지 않는 list_id를 참조하는 레코드는 lists에서 제외하고 {@link AggregationReport#orphanedVesselIds()}로
 * 보고합니다. 상위 데이터 결함이 있어도 리포트 전체는 실패하지 않습니다.
 *
 * <p>출력 순서: list_count 내림차순, 동률은 MMSI가 처음 등장한 순서 (안정 정렬).
 */
public class AggregationEngine {

  private static final Comparator<AggregatedVessel> BY_LIST_COUNT_DESC =
      Comparator.comparingInt(AggregatedVessel::listCount).reversed();

  public AggregationReport aggregate(
      IdentityIndex index, Map<Long, WatchlistMetadata> listsById) {
    List<AggregatedVessel> vessels = new ArrayList<>(index.byMmsi().size());
    List<Long> orphaned = new ArrayList<>();

    for (Map.Entry<String, List<VesselRecord>> entry : index.byMmsi().entrySet()) {
      List<VesselRecord> records = entry.getValue();
      Map<Long, WatchlistMetadata> memberships = new LinkedHashMap<>();
      for (VesselRecord record : records) {
        WatchlistMetadata list = listsById.get(record.listId());
        if (list == null) {
          orphaned.add(record.id());
          continue;
        }
        memberships.putIfAbsent(list.listId(), list);
      }
      vessels.add(
          new AggregatedVessel(
              entry.getKey(),
              firstPresent(records, VesselRecord::imo),
              firstPresent(records, VesselRecord::name),
              firstPresent(records, VesselRecord::flag),
              new ArrayList<>(memberships.values())));
    }

    // List.sort는 안정 정렬이므로 동률은 키 등장 순서를 유지
    vessels.sort(BY_LIST_COUNT_DESC);
    return new AggregationReport(vessels, orphaned);
  }

  private static String firstPresent(
      List<VesselRecord> records, Function<VesselRecord, String> field) {
    for (VesselRecord record : records) {
      String value = field.apply(record);
      if (VesselRecord.isPresent(value)) {
        return value;
      }
    }
    return null;
  }
}
