package vessel.watchlist.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** GET /analytics/vessels/aggregated 응답 */
public record AggregatedVesselsResponse(
    @JsonProperty("total_unique_vessels") int totalUniqueVessels,
    @JsonProperty("vessels") List<AggregatedVessel> vessels) {

  public record AggregatedVessel(
      @JsonProperty("mmsi") String mmsi,
      @JsonProperty("imo") String imo,
      @JsonProperty("name") String name,
      @JsonProperty("flag") String flag,
      @JsonProperty("list_count") int listCount,
      @JsonProperty("lists") List<ListMembership> lists) {}

  public record ListMembership(
      @JsonProperty("list_id") Long listId,
      @JsonProperty("list_name") String listName,
      @JsonProperty("list_color") String listColor) {}
}
