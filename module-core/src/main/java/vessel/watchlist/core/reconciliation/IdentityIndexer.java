package vessel.watchlist.core.reconciliation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import vessel.watchlist.core.domain.model.VesselRecord;

/**
 * MMSI/IMO 인덱스 빌더
 *
 * <ul>
 *   <li>키가 비어있는 레코드는 해당 인덱스에서만 제외 (IMO가 없어도 MMSI 인덱스에는 포함)
 *   <li>키는 정확 일치 문자열로만 비교하며 정규화하지 않음
 * </ul>
 */
public class IdentityIndexer {

  public IdentityIndex index(List<VesselRecord> vessels) {
    return new IdentityIndex(
        groupBy(vessels, VesselRecord::mmsi), groupBy(vessels, VesselRecord::imo));
  }

  private static Map<String, List<VesselRecord>> groupBy(
      List<VesselRecord> vessels, Function<VesselRecord, String> keyExtractor) {
    Map<String, List<VesselRecord>> grouped = new LinkedHashMap<>();
    for (VesselRecord vessel : vessels) {
      String key = keyExtractor.apply(vessel);
      if (!VesselRecord.isPresent(key)) {
        continue;
      }
      grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(vessel);
    }
    grouped.replaceAll((key, records) -> Collections.unmodifiableList(records));
    return Collections.unmodifiableMap(grouped);
  }
}
