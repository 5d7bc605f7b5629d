package vessel.watchlist.core.port.out;

import java.util.List;
import vessel.watchlist.core.domain.model.VesselRecord;
import vessel.watchlist.core.domain.model.WatchlistMetadata;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;

/**
 * Port for reading vessel records and watchlist metadata.
 *
 * <p>Implemented by module-infra adapters. The reconciliation engine never writes through this
 * port; it only consumes one consistent snapshot per computation.
 *
 * <p>Implementations translate storage failures into {@link
 * vessel.watchlist.error.exception.SnapshotFetchException}.
 */
public interface VesselRecordStore {

  /**
   * Fetch every vessel record across all lists, in stable store iteration order.
   *
   * @return all vessel records
   */
  List<VesselRecord> fetchAllVessels();

  /**
   * Fetch the metadata of every watchlist.
   *
   * @return all watchlists
   */
  List<WatchlistMetadata> fetchAllLists();

  /**
   * Fetch lists and vessels together in a single consistent read, so that one report never mixes
   * pre- and post-edit state.
   *
   * @return the snapshot
   */
  WatchlistSnapshot fetchSnapshot();
}
