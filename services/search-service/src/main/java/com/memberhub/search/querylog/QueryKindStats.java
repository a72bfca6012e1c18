package com.memberhub.search.querylog;

public record QueryKindStats(
    QueryKind queryKind,
    long queryCount,
    double averageLatencyMs,
    long zeroResultCount,
    long clickedQueryCount
) {
}
