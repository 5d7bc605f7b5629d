package vessel.watchlist.core.reconciliation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import vessel.watchlist.core.domain.model.ConflictGroup;
import vessel.watchlist.core.domain.model.IdentityKind;
import vessel.watchlist.core.domain.model.InconsistencyGroup;
import vessel.watchlist.core.domain.model.VesselRecord;

/**
 * 식별자 충돌 탐지기
 *
 * <h3>3개의 독립 패스</h3>
 *
 * <ol>
 *   <li><b>MMSI 중복</b>: 같은 MMSI가 서로 다른 리스트 2개 이상에 등장
 *   <li><b>IMO 중복</b>: 같은 알고리즘을 IMO 인덱스에 적용
 *   <li><b>MMSI-IMO 불일치</b>: 하나의 MMSI에 서로 다른 IMO가 2개 이상 (리스트 수와 무관). 그룹에는 IMO 유무와
 *       상관없이 그 MMSI의 모든 레코드가 담깁니다.
 * </ol>
 *
 * <p>같은 리스트 안의 중복은 데이터 입력 문제이지 식별자 충돌이 아니므로 1, 2번 패스에서 제외합니다. 각 패스는 인덱스만 읽으므로 병렬 실행해도
 * 안전합니다.
 */
public class ConflictDetector {

  public List<ConflictGroup> detectMmsiDuplicates(IdentityIndex index) {
    return crossListDuplicates(index.byMmsi(), IdentityKind.MMSI);
  }

  public List<ConflictGroup> detectImoDuplicates(IdentityIndex index) {
    return crossListDuplicates(index.byImo(), IdentityKind.IMO);
  }

  public List<InconsistencyGroup> detectInconsistencies(IdentityIndex index) {
    List<InconsistencyGroup> groups = new ArrayList<>();
    for (Map.Entry<String, List<VesselRecord>> entry : index.byMmsi().entrySet()) {
      Set<String> imos = new LinkedHashSet<>();
      for (VesselRecord vessel : entry.getValue()) {
        if (vessel.hasImo()) {
          imos.add(vessel.imo());
        }
      }
      // IMO가 없는 레코드도 같은 MMSI의 기여 레코드로 포함
      if (imos.size() >= 2) {
        groups.add(
            new InconsistencyGroup(entry.getKey(), new ArrayList<>(imos), entry.getValue()));
      }
    }
    return groups;
  }

  private static List<ConflictGroup> crossListDuplicates(
      Map<String, List<VesselRecord>> byKey, IdentityKind kind) {
    List<ConflictGroup> groups = new ArrayList<>();
    for (Map.Entry<String, List<VesselRecord>> entry : byKey.entrySet()) {
      int distinctLists = countDistinctLists(entry.getValue());
      if (distinctLists >= 2) {
        groups.add(new ConflictGroup(entry.getKey(), kind, entry.getValue(), distinctLists));
      }
    }
    return groups;
  }

  private static int countDistinctLists(List<VesselRecord> vessels) {
    Set<Long> listIds = new LinkedHashSet<>();
    for (VesselRecord vessel : vessels) {
      listIds.add(vessel.listId());
    }
    return listIds.size();
  }
}
