package vessel.watchlist.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** GET /vessels/conflicts 응답 */
public record ConflictReportResponse(
    @JsonProperty("conflicts") Conflicts conflicts,
    @JsonProperty("total_conflicts") int totalConflicts) {

  public record Conflicts(
      @JsonProperty("mmsi_duplicates") List<MmsiDuplicate> mmsiDuplicates,
      @JsonProperty("imo_duplicates") List<ImoDuplicate> imoDuplicates,
      @JsonProperty("mmsi_imo_inconsistencies") List<Inconsistency> inconsistencies) {}

  public record MmsiDuplicate(
      @JsonProperty("mmsi") String mmsi,
      @JsonProperty("count") int count,
      @JsonProperty("vessels") List<VesselRefResponse> vessels) {}

  public record ImoDuplicate(
      @JsonProperty("imo") String imo,
      @JsonProperty("count") int count,
      @JsonProperty("vessels") List<VesselRefResponse> vessels) {}

  public record Inconsistency(
      @JsonProperty("mmsi") String mmsi,
      @JsonProperty("imos") List<String> imos,
      @JsonProperty("vessels") List<VesselRefResponse> vessels) {}
}
