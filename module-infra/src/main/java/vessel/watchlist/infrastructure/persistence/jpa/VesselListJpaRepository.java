package vessel.watchlist.infrastructure.persistence.jpa;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import vessel.watchlist.infrastructure.persistence.entity.VesselListJpaEntity;

/** Spring Data JPA Repository for watchlists. */
public interface VesselListJpaRepository extends JpaRepository<VesselListJpaEntity, Long> {

  List<VesselListJpaEntity> findAllByOrderByIdAsc();
}
