package vessel.watchlist.core.reconciliation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import vessel.watchlist.core.domain.model.VesselRecord;
import vessel.watchlist.core.domain.model.WatchlistMetadata;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;
import vessel.watchlist.core.domain.model.WatchlistStats;
import vessel.watchlist.core.domain.model.WatchlistStats.FlagCount;
import vessel.watchlist.core.domain.model.WatchlistStats.ListVesselCount;

/** 스냅샷 요약 통계 (리스트별 선박 수, 국적별 분포, IMO/위치 보유율) */
public class WatchlistStatsCalculator {

  public WatchlistStats calculate(WatchlistSnapshot snapshot) {
    Map<Long, Integer> vesselsPerList = new HashMap<>();
    Map<String, Integer> flags = new LinkedHashMap<>();
    int withImo = 0;
    int withPosition = 0;

    for (VesselRecord vessel : snapshot.vessels()) {
      vesselsPerList.merge(vessel.listId(), 1, Integer::sum);
      if (VesselRecord.isPresent(vessel.flag())) {
        flags.merge(vessel.flag(), 1, Integer::sum);
      }
      if (vessel.hasImo()) {
        withImo++;
      }
      if (VesselRecord.isPresent(vessel.lastPosition())) {
        withPosition++;
      }
    }

    List<ListVesselCount> lists = new ArrayList<>(snapshot.lists().size());
    for (WatchlistMetadata list : snapshot.lists()) {
      lists.add(new ListVesselCount(list, vesselsPerList.getOrDefault(list.listId(), 0)));
    }
    List<FlagCount> flagCounts = new ArrayList<>(flags.size());
    flags.forEach((flag, count) -> flagCounts.add(new FlagCount(flag, count)));

    return new WatchlistStats(
        snapshot.lists().size(),
        snapshot.vessels().size(),
        withImo,
        withPosition,
        lists,
        flagCounts);
  }
}
