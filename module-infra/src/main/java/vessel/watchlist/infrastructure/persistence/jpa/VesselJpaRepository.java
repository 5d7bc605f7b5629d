package vessel.watchlist.infrastructure.persistence.jpa;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import vessel.watchlist.infrastructure.persistence.entity.VesselJpaEntity;

/**
 * Spring Data JPA Repository for vessel records.
 *
 * <p>INTERNAL to the infrastructure layer. The domain reads through {@link
 * vessel.watchlist.core.port.out.VesselRecordStore}.
 */
public interface VesselJpaRepository extends JpaRepository<VesselJpaEntity, Long> {

  /**
   * Find every vessel record in primary key order, the stable iteration order the reconciliation
   * passes rely on.
   *
   * @return all vessel entities
   */
  List<VesselJpaEntity> findAllByOrderByIdAsc();
}
