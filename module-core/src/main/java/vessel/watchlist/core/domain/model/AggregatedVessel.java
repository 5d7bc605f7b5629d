package vessel.watchlist.core.domain.model;

import java.util.List;

/**
 * MMSI 기준으로 모든 워치리스트를 병합한 정규 선박 뷰
 *
 * <p>imo/name/flag는 스냅샷 순서상 처음으로 값이 있는 레코드에서 가져오며, 없으면 null입니다.
 */
public record AggregatedVessel(
    String mmsi, String imo, String name, String flag, List<WatchlistMetadata> lists) {

  public AggregatedVessel {
    lists = List.copyOf(lists);
  }

  public int listCount() {
    return lists.size();
  }
}
