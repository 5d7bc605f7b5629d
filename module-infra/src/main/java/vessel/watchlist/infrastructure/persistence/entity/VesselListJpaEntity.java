package vessel.watchlist.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import vessel.watchlist.core.domain.model.WatchlistMetadata;

@Entity
@Table(name = "vessel_lists")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VesselListJpaEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "color")
  private String color;

  public VesselListJpaEntity(Long id, String name, String color) {
    this.id = id;
    this.name = name;
    this.color = color;
  }

  public WatchlistMetadata toDomain() {
    return new WatchlistMetadata(id, name, color);
  }
}
