package com.memberhub.search.filter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record InFilter(String key, List<Object> values) implements MetadataFilter {

    public InFilter {
        values = List.copyOf(values);
    }

    @Override
    public boolean matches(Map<String, Object> metadata) {
        Object stored = MetadataValues.lookup(metadata, key);
        for (Object candidate : values) {
            if (MetadataValues.sameValue(stored, candidate)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("type", "in");
        description.put("key", key);
        description.put("values", values);
        return description;
    }
}
