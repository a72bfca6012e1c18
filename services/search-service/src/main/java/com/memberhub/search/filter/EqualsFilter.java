package com.memberhub.search.filter;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public record EqualsFilter(String key, Object value) implements MetadataFilter {

    @Override
    public boolean matches(Map<String, Object> metadata) {
        Object stored = MetadataValues.lookup(metadata, key);
        if (stored instanceof Collection<?> items) {
            for (Object item : items) {
                if (MetadataValues.sameValue(item, value)) {
                    return true;
                }
            }
            return false;
        }
        return MetadataValues.sameValue(stored, value);
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("type", "eq");
        description.put("key", key);
        description.put("value", value);
        return description;
    }
}
