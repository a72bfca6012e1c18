package com.memberhub.search.retrieval.ann;

import java.time.Instant;

public record AnnIndexStatus(
    boolean enabled,
    boolean rebuilding,
    long generation,
    int size,
    int pendingVectors,
    Instant builtAt,
    Long lastBuildMs,
    String lastError
) {
}
