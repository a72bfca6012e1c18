package com.memberhub.search.filter;

import java.util.List;
import java.util.Map;

public interface MetadataFilter {

    String key();

    boolean matches(Map<String, Object> metadata);

    Map<String, Object> describe();

    static boolean allMatch(List<MetadataFilter> filters, Map<String, Object> metadata) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        Map<String, Object> safe = metadata == null ? Map.of() : metadata;
        for (MetadataFilter filter : filters) {
            if (!filter.matches(safe)) {
                return false;
            }
        }
        return true;
    }
}
