package vessel.watchlist.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** GET /vessels/conflicts/affected-lists 응답: UI의 리스트 카드 충돌 표시용 */
public record AffectedListsResponse(
    @JsonProperty("list_ids") List<Long> listIds,
    @JsonProperty("total_conflicts") int totalConflicts) {}
