package vessel.watchlist.core.domain.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** 충돌 탐지 3개 패스의 결과 묶음 */
public record ConflictReport(
    List<ConflictGroup> mmsiDuplicates,
    List<ConflictGroup> imoDuplicates,
    List<InconsistencyGroup> inconsistencies) {

  public ConflictReport {
    mmsiDuplicates = List.copyOf(mmsiDuplicates);
    imoDuplicates = List.copyOf(imoDuplicates);
    inconsistencies = List.copyOf(inconsistencies);
  }

  public int totalConflicts() {
    return mmsiDuplicates.size() + imoDuplicates.size() + inconsistencies.size();
  }

  /**
   * 어떤 그룹에든 참조된 레코드의 list_id 합집합
   *
   * <p>MMSI 중복 → IMO 중복 → 불일치 순서로 처음 등장한 순서를 유지합니다. UI는 이 집합으로 리스트 카드에 충돌 표시를 합니다.
   */
  public Set<Long> affectedListIds() {
    Set<Long> listIds = new LinkedHashSet<>();
    mmsiDuplicates.forEach(group -> group.vessels().forEach(v -> listIds.add(v.listId())));
    imoDuplicates.forEach(group -> group.vessels().forEach(v -> listIds.add(v.listId())));
    inconsistencies.forEach(group -> group.vessels().forEach(v -> listIds.add(v.listId())));
    return listIds;
  }
}
