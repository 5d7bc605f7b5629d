package vessel.watchlist.core.domain.model;

/**
 * 워치리스트에 등록된 선박 레코드 (순수 도메인)
 *
 * <p>JPA 엔티티는 module-infra에 별도로 존재합니다. 식별자(MMSI/IMO)는 불투명한 문자열로 취급하며 길이나 숫자 여부를 검증하지 않습니다. 공백
 * 제거 같은 정규화는 쓰기 경로의 책임입니다.
 *
 * @param id 저장소 내 고유 행 ID
 * @param mmsi 9자리 MMSI (없으면 null 또는 빈 문자열)
 * @param imo 7자리 IMO (없으면 null 또는 빈 문자열)
 * @param listId 소속 워치리스트 ID (레코드는 정확히 하나의 리스트에 속함)
 */
public record VesselRecord(
    Long id,
    String mmsi,
    String imo,
    String name,
    String callsign,
    String flag,
    String lastPosition,
    String note,
    Long listId) {

  /** 식별 키만 가진 레코드 생성 (테스트/픽스처용 축약 팩토리) */
  public static VesselRecord of(Long id, String mmsi, String imo, Long listId) {
    return new VesselRecord(id, mmsi, imo, null, null, null, null, null, listId);
  }

  public boolean hasMmsi() {
    return isPresent(mmsi);
  }

  public boolean hasImo() {
    return isPresent(imo);
  }

  /** null과 빈 문자열을 "값 없음"으로 동일하게 취급 */
  public static boolean isPresent(String value) {
    return value != null && !value.isEmpty();
  }
}
