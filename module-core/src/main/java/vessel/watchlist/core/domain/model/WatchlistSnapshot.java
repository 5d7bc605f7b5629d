package vessel.watchlist.core.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 단일 일관 읽기로 얻은 워치리스트 전체 스냅샷
 *
 * <p>리스트와 선박 레코드를 함께 보관하여, 하나의 리포트가 편집 전/후 상태를 섞지 않도록 합니다. 레코드 순서는 저장소 반복 순서이며 "첫 번째 비어있지
 * 않은 값" 규칙의 기준이 됩니다.
 */
public record WatchlistSnapshot(List<WatchlistMetadata> lists, List<VesselRecord> vessels) {

  public WatchlistSnapshot {
    lists = List.copyOf(Objects.requireNonNull(lists, "lists"));
    vessels = List.copyOf(Objects.requireNonNull(vessels, "vessels"));
  }

  public static WatchlistSnapshot empty() {
    return new WatchlistSnapshot(List.of(), List.of());
  }

  /** list_id → 메타데이터 (리스트 테이블 순서 유지) */
  public Map<Long, WatchlistMetadata> listsById() {
    Map<Long, WatchlistMetadata> byId = new LinkedHashMap<>();
    for (WatchlistMetadata list : lists) {
      byId.putIfAbsent(list.listId(), list);
    }
    return Collections.unmodifiableMap(byId);
  }
}
