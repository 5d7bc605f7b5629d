package vessel.watchlist.core.reconciliation;

import java.util.List;
import java.util.Map;
import vessel.watchlist.core.domain.model.VesselRecord;

/**
 * 식별 키 → 레코드 목록 인덱스
 *
 * <p>요청마다 스냅샷으로부터 새로 만들어지며 영속화되지 않습니다. 두 맵 모두 키가 처음 등장한 순서를 유지하고, 각 레코드 목록은 스냅샷 순서입니다.
 */
public record IdentityIndex(
    Map<String, List<VesselRecord>> byMmsi, Map<String, List<VesselRecord>> byImo) {}
