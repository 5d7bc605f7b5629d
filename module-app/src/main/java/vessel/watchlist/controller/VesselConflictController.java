package vessel.watchlist.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import vessel.watchlist.application.dto.AffectedListsResponse;
import vessel.watchlist.application.dto.ConflictReportResponse;
import vessel.watchlist.application.mapper.ReconciliationReportMapper;
import vessel.watchlist.application.service.VesselReconciliationService;
import vessel.watchlist.controller.util.AsyncResponseUtils;

/**
 * 선박 식별자 충돌 API
 *
 * <ul>
 *   <li>GET /vessels/conflicts - MMSI/IMO 중복 및 MMSI-IMO 불일치
 *   <li>GET /vessels/conflicts/affected-lists - 충돌에 연루된 리스트 ID
 * </ul>
 */
@Tag(name = "Vessel Conflicts", description = "워치리스트 간 선박 식별자 충돌 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/vessels/conflicts")
public class VesselConflictController {

  private final VesselReconciliationService reconciliationService;
  private final ReconciliationReportMapper mapper;

  @Operation(
      summary = "식별자 충돌 리포트",
      description = "모든 워치리스트에 걸친 MMSI/IMO 충돌을 조회합니다.")
  @GetMapping
  public CompletableFuture<ResponseEntity<ConflictReportResponse>> getConflicts() {
    return AsyncResponseUtils.map(
        reconciliationService.reconcileAsync(), mapper::toConflictReport);
  }

  @Operation(
      summary = "충돌 연루 리스트",
      description = "충돌 그룹에 포함된 레코드의 리스트 ID를 처음 등장한 순서로 반환합니다.")
  @GetMapping("/affected-lists")
  public CompletableFuture<ResponseEntity<AffectedListsResponse>> getAffectedLists() {
    return AsyncResponseUtils.map(
        reconciliationService.reconcileAsync(), mapper::toAffectedLists);
  }
}
