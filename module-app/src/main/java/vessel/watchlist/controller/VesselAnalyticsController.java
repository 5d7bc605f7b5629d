package vessel.watchlist.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import vessel.watchlist.application.dto.AggregatedVesselsResponse;
import vessel.watchlist.application.dto.WatchlistStatsResponse;
import vessel.watchlist.application.mapper.ReconciliationReportMapper;
import vessel.watchlist.application.service.VesselReconciliationService;
import vessel.watchlist.controller.util.AsyncResponseUtils;

@Tag(name = "Vessel Analytics", description = "워치리스트 선박 집계/통계 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/analytics")
public class VesselAnalyticsController {

  private final VesselReconciliationService reconciliationService;
  private final ReconciliationReportMapper mapper;

  @Operation(
      summary = "MMSI 기준 선박 집계",
      description = "list_count 내림차순으로 정렬된 집계 선박 목록")
  @GetMapping("/vessels/aggregated")
  public CompletableFuture<ResponseEntity<AggregatedVesselsResponse>> getAggregatedVessels() {
    return AsyncResponseUtils.map(
        reconciliationService.reconcileAsync(), mapper::toAggregatedVessels);
  }

  @Operation(summary = "워치리스트 통계")
  @GetMapping("/stats")
  public CompletableFuture<ResponseEntity<WatchlistStatsResponse>> getStats() {
    return AsyncResponseUtils.map(reconciliationService.reconcileAsync(), mapper::toStats);
  }
}
