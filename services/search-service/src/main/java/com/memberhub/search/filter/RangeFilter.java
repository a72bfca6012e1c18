package com.memberhub.search.filter;

import java.util.LinkedHashMap;
import java.util.Map;

public record RangeFilter(String key, Object min, Object max) implements MetadataFilter {

    @Override
    public boolean matches(Map<String, Object> metadata) {
        Object stored = MetadataValues.lookup(metadata, key);
        if (stored == null) {
            return false;
        }
        if (min != null) {
            Integer cmp = MetadataValues.compare(stored, min);
            if (cmp == null || cmp < 0) {
                return false;
            }
        }
        if (max != null) {
            Integer cmp = MetadataValues.compare(stored, max);
            if (cmp == null || cmp > 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("type", "range");
        description.put("key", key);
        if (min != null) {
            description.put("min", min);
        }
        if (max != null) {
            description.put("max", max);
        }
        return description;
    }
}
