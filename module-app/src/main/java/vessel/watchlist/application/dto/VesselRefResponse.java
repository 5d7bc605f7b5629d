package vessel.watchlist.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 충돌 그룹 안에서 참조되는 선박 레코드
 *
 * <p>list_name/list_color는 존재하지 않는 리스트를 가리키는 레코드에서 null입니다.
 */
public record VesselRefResponse(
    @JsonProperty("id") Long id,
    @JsonProperty("mmsi") String mmsi,
    @JsonProperty("imo") String imo,
    @JsonProperty("list_id") Long listId,
    @JsonProperty("list_name") String listName,
    @JsonProperty("list_color") String listColor) {}
