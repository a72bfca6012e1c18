package com.memberhub.search.querylog;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record QueryLogEntry(
    String id,
    String issuedBy,
    String queryText,
    QueryKind queryKind,
    List<Map<String, Object>> appliedFilters,
    int resultCount,
    String topResultId,
    Double topResultScore,
    long latencyMs,
    List<String> clickedResultIds,
    Instant createdAt
) {
}
