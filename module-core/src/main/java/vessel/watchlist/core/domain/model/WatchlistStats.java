package vessel.watchlist.core.domain.model;

import java.util.List;

/** 스냅샷 전체에 대한 요약 통계 */
public record WatchlistStats(
    int totalLists,
    int totalVessels,
    int withImo,
    int withPosition,
    List<ListVesselCount> lists,
    List<FlagCount> flags) {

  public WatchlistStats {
    lists = List.copyOf(lists);
    flags = List.copyOf(flags);
  }

  public int withoutImo() {
    return totalVessels - withImo;
  }

  public int uniqueFlags() {
    return flags.size();
  }

  public record ListVesselCount(WatchlistMetadata list, int vesselCount) {}

  public record FlagCount(String flag, int count) {}
}
