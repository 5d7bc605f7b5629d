package vessel.watchlist.core.domain.model;

/** 워치리스트 메타데이터 조회 테이블의 한 행 (읽기 전용) */
public record WatchlistMetadata(Long listId, String listName, String color) {}
