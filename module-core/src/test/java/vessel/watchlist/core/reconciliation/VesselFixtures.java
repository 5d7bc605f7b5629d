package vessel.watchlist.core.reconciliation;

import java.util.List;
import vessel.watchlist.core.domain.model.VesselRecord;
import vessel.watchlist.core.domain.model.WatchlistMetadata;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;

/** 정합성 테스트 공용 픽스처 */
final class VesselFixtures {

  static final WatchlistMetadata RED = new WatchlistMetadata(1L, "Red", "#ff0000");
  static final WatchlistMetadata BLUE = new WatchlistMetadata(2L, "Blue", "#0000ff");
  static final WatchlistMetadata GREEN = new WatchlistMetadata(3L, "Green", "green");

  private VesselFixtures() {}

  static VesselRecord vessel(long id, String mmsi, String imo, WatchlistMetadata list) {
    return VesselRecord.of(id, mmsi, imo, list.listId());
  }

  static VesselRecord vessel(
      long id, String mmsi, String imo, String name, String flag, WatchlistMetadata list) {
    return new VesselRecord(id, mmsi, imo, name, null, flag, null, null, list.listId());
  }

  static WatchlistSnapshot snapshot(List<VesselRecord> vessels) {
    return new WatchlistSnapshot(List.of(RED, BLUE, GREEN), vessels);
  }
}
