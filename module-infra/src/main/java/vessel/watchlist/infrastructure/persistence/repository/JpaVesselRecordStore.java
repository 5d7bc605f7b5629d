package vessel.watchlist.infrastructure.persistence.repository;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import vessel.watchlist.core.domain.model.VesselRecord;
import vessel.watchlist.core.domain.model.WatchlistMetadata;
import vessel.watchlist.core.domain.model.WatchlistSnapshot;
import vessel.watchlist.core.port.out.VesselRecordStore;
import vessel.watchlist.infrastructure.executor.LogicExecutor;
import vessel.watchlist.infrastructure.executor.TaskContext;
import vessel.watchlist.infrastructure.executor.strategy.ExceptionTranslator;
import vessel.watchlist.infrastructure.persistence.entity.VesselJpaEntity;
import vessel.watchlist.infrastructure.persistence.entity.VesselListJpaEntity;
import vessel.watchlist.infrastructure.persistence.jpa.VesselJpaRepository;
import vessel.watchlist.infrastructure.persistence.jpa.VesselListJpaRepository;

/**
 * JPA implementation of {@link VesselRecordStore}.
 *
 * <p>Maps JPA entities to pure domain records. Storage failures surface as {@link
 * vessel.watchlist.error.exception.SnapshotFetchException}.
 *
 * <p><b>Transactional:</b> read-only. {@link #fetchSnapshot()} reads lists and vessels inside one
 * REPEATABLE_READ transaction so both queries observe the same committed state.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaVesselRecordStore implements VesselRecordStore {

  private static final String COMPONENT = "VesselRecordStore";

  private final VesselJpaRepository vesselRepository;
  private final VesselListJpaRepository listRepository;
  private final LogicExecutor executor;

  @Override
  public List<VesselRecord> fetchAllVessels() {
    return executor.executeWithTranslation(
        this::readVessels,
        ExceptionTranslator.forSnapshotFetch(),
        TaskContext.of(COMPONENT, "fetchAllVessels"));
  }

  @Override
  public List<WatchlistMetadata> fetchAllLists() {
    return executor.executeWithTranslation(
        this::readLists,
        ExceptionTranslator.forSnapshotFetch(),
        TaskContext.of(COMPONENT, "fetchAllLists"));
  }

  @Override
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public WatchlistSnapshot fetchSnapshot() {
    return executor.executeWithTranslation(
        this::readSnapshot,
        ExceptionTranslator.forSnapshotFetch(),
        TaskContext.of(COMPONENT, "fetchSnapshot"));
  }

  private WatchlistSnapshot readSnapshot() {
    WatchlistSnapshot snapshot = new WatchlistSnapshot(readLists(), readVessels());
    log.debug(
        "[VesselRecordStore] snapshot loaded: lists={}, vessels={}",
        snapshot.lists().size(),
        snapshot.vessels().size());
    return snapshot;
  }

  private List<WatchlistMetadata> readLists() {
    return listRepository.findAllByOrderByIdAsc().stream()
        .map(VesselListJpaEntity::toDomain)
        .toList();
  }

  private List<VesselRecord> readVessels() {
    return vesselRepository.findAllByOrderByIdAsc().stream()
        .map(VesselJpaEntity::toDomain)
        .toList();
  }
}
