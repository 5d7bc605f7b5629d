package vessel.watchlist.application.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import vessel.watchlist.application.dto.AffectedListsResponse;
import vessel.watchlist.application.dto.AggregatedVesselsResponse;
import vessel.watchlist.application.dto.ConflictReportResponse;
import vessel.watchlist.application.dto.ConflictReportResponse.Conflicts;
import vessel.watchlist.application.dto.ConflictReportResponse.ImoDuplicate;
import vessel.watchlist.application.dto.ConflictReportResponse.Inconsistency;
import vessel.watchlist.application.dto.ConflictReportResponse.MmsiDuplicate;
import vessel.watchlist.application.dto.VesselRefResponse;
import vessel.watchlist.application.dto.WatchlistStatsResponse;
import vessel.watchlist.core.domain.model.AggregatedVessel;
import vessel.watchlist.core.domain.model.ConflictReport;
import vessel.watchlist.core.domain.model.ReconciliationResult;
import vessel.watchlist.core.domain.model.VesselRecord;
import vessel.watchlist.core.domain.model.WatchlistMetadata;
import vessel.watchlist.core.domain.model.WatchlistStats;

/**
 * 정합성 결과 → 프론트엔드 응답 형태 변환
 *
 * <p>필드명과 중첩 구조는 기존 프론트엔드와의 호환을 위해 고정입니다. 추가 로직 없이 순서를 그대로 옮깁니다.
 */
@Component
public class ReconciliationReportMapper {

  public ConflictReportResponse toConflictReport(ReconciliationResult result) {
    ConflictReport conflicts = result.conflicts();
    Map<Long, WatchlistMetadata> lists = result.snapshot().listsById();

    List<MmsiDuplicate> mmsiDuplicates =
        conflicts.mmsiDuplicates().stream()
            .map(g -> new MmsiDuplicate(g.key(), g.count(), toRefs(g.vessels(), lists)))
            .toList();
    List<ImoDuplicate> imoDuplicates =
        conflicts.imoDuplicates().stream()
            .map(g -> new ImoDuplicate(g.key(), g.count(), toRefs(g.vessels(), lists)))
            .toList();
    List<Inconsistency> inconsistencies =
        conflicts.inconsistencies().stream()
            .map(g -> new Inconsistency(g.mmsi(), g.imos(), toRefs(g.vessels(), lists)))
            .toList();

    return new ConflictReportResponse(
        new Conflicts(mmsiDuplicates, imoDuplicates, inconsistencies),
        conflicts.totalConflicts());
  }

  public AffectedListsResponse toAffectedLists(ReconciliationResult result) {
    ConflictReport conflicts = result.conflicts();
    return new AffectedListsResponse(
        new ArrayList<>(conflicts.affectedListIds()), conflicts.totalConflicts());
  }

  public AggregatedVesselsResponse toAggregatedVessels(ReconciliationResult result) {
    List<AggregatedVesselsResponse.AggregatedVessel> vessels =
        result.aggregation().vessels().stream().map(this::toAggregatedVessel).toList();
    return new AggregatedVesselsResponse(result.aggregation().totalUniqueVessels(), vessels);
  }

  public WatchlistStatsResponse toStats(ReconciliationResult result) {
    WatchlistStats stats = result.stats();
    WatchlistStatsResponse.Overview overview =
        new WatchlistStatsResponse.Overview(
            stats.totalLists(),
            stats.totalVessels(),
            stats.uniqueFlags(),
            stats.withImo(),
            stats.withoutImo(),
            stats.withPosition());
    List<WatchlistStatsResponse.ListStat> lists =
        stats.lists().stream()
            .map(
                l ->
                    new WatchlistStatsResponse.ListStat(
                        l.list().listId(), l.list().listName(), l.list().color(), l.vesselCount()))
            .toList();
    List<WatchlistStatsResponse.FlagStat> flags =
        stats.flags().stream()
            .map(f -> new WatchlistStatsResponse.FlagStat(f.flag(), f.count()))
            .toList();
    return new WatchlistStatsResponse(overview, lists, flags);
  }

  private AggregatedVesselsResponse.AggregatedVessel toAggregatedVessel(AggregatedVessel vessel) {
    List<AggregatedVesselsResponse.ListMembership> lists =
        vessel.lists().stream()
            .map(
                l ->
                    new AggregatedVesselsResponse.ListMembership(
                        l.listId(), l.listName(), l.color()))
            .toList();
    return new AggregatedVesselsResponse.AggregatedVessel(
        vessel.mmsi(), vessel.imo(), vessel.name(), vessel.flag(), vessel.listCount(), lists);
  }

  private static List<VesselRefResponse> toRefs(
      List<VesselRecord> vessels, Map<Long, WatchlistMetadata> lists) {
    return vessels.stream().map(v -> toRef(v, lists.get(v.listId()))).toList();
  }

  /** 고아 레코드는 list_name/list_color를 null로 둔다 */
  private static VesselRefResponse toRef(VesselRecord vessel, WatchlistMetadata list) {
    return new VesselRefResponse(
        vessel.id(),
        vessel.mmsi(),
        vessel.imo(),
        vessel.listId(),
        list != null ? list.listName() : null,
        list != null ? list.color() : null);
  }
}
