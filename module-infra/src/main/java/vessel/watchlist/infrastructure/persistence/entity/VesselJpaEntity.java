package vessel.watchlist.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import vessel.watchlist.core.domain.model.VesselRecord;

/**
 * 워치리스트 선박 레코드
 *
 * <p>list_id는 FK 연관 대신 값 컬럼으로 매핑합니다. 삭제된 리스트를 가리키는 레코드도 그대로 읽어 정합성 리포트에서 고아로 보고하기 위함입니다.
 */
@Entity
@Table(
    name = "vessels",
    indexes = {
      @Index(name = "idx_vessels_mmsi", columnList = "mmsi"),
      @Index(name = "idx_vessels_imo", columnList = "imo"),
      @Index(name = "idx_vessels_list_id", columnList = "list_id")
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VesselJpaEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "mmsi", length = 9)
  private String mmsi;

  @Column(name = "imo", length = 7)
  private String imo;

  @Column(name = "name")
  private String name;

  @Column(name = "callsign")
  private String callsign;

  @Column(name = "flag")
  private String flag;

  @Column(name = "lastposition")
  private String lastPosition;

  @Column(name = "note")
  private String note;

  @Column(name = "list_id", nullable = false)
  private Long listId;

  public VesselJpaEntity(
      Long id,
      String mmsi,
      String imo,
      String name,
      String callsign,
      String flag,
      String lastPosition,
      String note,
      Long listId) {
    this.id = id;
    this.mmsi = mmsi;
    this.imo = imo;
    this.name = name;
    this.callsign = callsign;
    this.flag = flag;
    this.lastPosition = lastPosition;
    this.note = note;
    this.listId = listId;
  }

  public VesselRecord toDomain() {
    return new VesselRecord(id, mmsi, imo, name, callsign, flag, lastPosition, note, listId);
  }
}
