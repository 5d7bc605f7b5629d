package vessel.watchlist.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** GET /analytics/stats 응답 */
public record WatchlistStatsResponse(
    @JsonProperty("overview") Overview overview,
    @JsonProperty("lists") List<ListStat> lists,
    @JsonProperty("flags") List<FlagStat> flags) {

  public record Overview(
      @JsonProperty("total_lists") int totalLists,
      @JsonProperty("total_vessels") int totalVessels,
      @JsonProperty("unique_flags") int uniqueFlags,
      @JsonProperty("with_imo") int withImo,
      @JsonProperty("without_imo") int withoutImo,
      @JsonProperty("with_position") int withPosition) {}

  public record ListStat(
      @JsonProperty("list_id") Long listId,
      @JsonProperty("name") String name,
      @JsonProperty("color") String color,
      @JsonProperty("vessel_count") int vesselCount) {}

  public record FlagStat(@JsonProperty("flag") String flag, @JsonProperty("count") int count) {}
}
