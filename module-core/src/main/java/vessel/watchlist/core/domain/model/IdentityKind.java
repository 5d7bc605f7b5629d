package vessel.watchlist.core.domain.model;

/** 선박 식별 키 종류 */
public enum IdentityKind {
  MMSI,
  IMO
}
