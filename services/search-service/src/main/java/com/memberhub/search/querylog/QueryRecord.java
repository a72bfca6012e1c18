package com.memberhub.search.querylog;

import java.util.List;
import java.util.Map;

public record QueryRecord(
    String issuedBy,
    String queryText,
    QueryKind queryKind,
    List<Map<String, Object>> appliedFilters,
    int resultCount,
    String topResultId,
    Double topResultScore,
    long latencyMs
) {
}
