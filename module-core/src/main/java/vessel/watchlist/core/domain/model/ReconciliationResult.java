package vessel.watchlist.core.domain.model;

/** 하나의 스냅샷에 대해 실행된 전체 파이프라인 결과 */
public record ReconciliationResult(
    WatchlistSnapshot snapshot,
    ConflictReport conflicts,
    AggregationReport aggregation,
    WatchlistStats stats) {}
