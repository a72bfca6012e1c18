package com.memberhub.search.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public final class MetadataFilters {
    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)*");

    private MetadataFilters() {
    }

    public static List<MetadataFilter> parse(List<Map<String, Object>> expressions, Map<String, Object> equalityShorthand) {
        List<MetadataFilter> filters = new ArrayList<>();
        if (equalityShorthand != null) {
            addShorthand(filters, "", equalityShorthand);
        }
        if (expressions != null) {
            for (Map<String, Object> expression : expressions) {
                filters.add(parse(expression));
            }
        }
        return List.copyOf(filters);
    }

    public static MetadataFilter parse(Map<String, Object> expression) {
        if (expression == null) {
            throw new InvalidFilterException("filter must be an object");
        }
        Object rawType = expression.get("type");
        String type = rawType == null ? "eq" : rawType.toString().trim().toLowerCase(Locale.ROOT);
        String key = expression.get("key") == null ? null : expression.get("key").toString();
        return switch (type) {
            case "eq" -> equalsFilter(key, expression.get("value"));
            case "range" -> rangeFilter(key, expression.get("min"), expression.get("max"));
            case "in" -> inFilter(key, expression.get("values"));
            default -> throw new InvalidFilterException("unknown filter type: " + rawType);
        };
    }

    public static List<Map<String, Object>> describe(List<MetadataFilter> filters) {
        if (filters == null) {
            return List.of();
        }
        return filters.stream().map(MetadataFilter::describe).toList();
    }

    private static void addShorthand(List<MetadataFilter> filters, String prefix, Map<?, ?> shorthand) {
        if (shorthand.isEmpty() && !prefix.isEmpty()) {
            throw new InvalidFilterException("filter on '" + prefix + "' has an empty object value");
        }
        for (Map.Entry<?, ?> entry : shorthand.entrySet()) {
            String key = prefix + entry.getKey();
            if (entry.getValue() instanceof Map<?, ?> nested) {
                validateKey(key);
                addShorthand(filters, key + ".", nested);
            } else {
                filters.add(equalsFilter(key, entry.getValue()));
            }
        }
    }

    private static EqualsFilter equalsFilter(String key, Object value) {
        validateKey(key);
        if (!MetadataValues.isScalar(value)) {
            throw new InvalidFilterException("eq filter on '" + key + "' needs a string, number or boolean value");
        }
        return new EqualsFilter(key, value);
    }

    private static RangeFilter rangeFilter(String key, Object min, Object max) {
        validateKey(key);
        if (min == null && max == null) {
            throw new InvalidFilterException("range filter on '" + key + "' needs min or max");
        }
        if (min != null && !(min instanceof Number || min instanceof String)) {
            throw new InvalidFilterException("range filter on '" + key + "' has a non-comparable min");
        }
        if (max != null && !(max instanceof Number || max instanceof String)) {
            throw new InvalidFilterException("range filter on '" + key + "' has a non-comparable max");
        }
        if (min != null && max != null) {
            Integer cmp = MetadataValues.compare(min, max);
            if (cmp == null) {
                throw new InvalidFilterException("range filter on '" + key + "' mixes numeric and text bounds");
            }
            if (cmp > 0) {
                throw new InvalidFilterException("range filter on '" + key + "' has min greater than max");
            }
        }
        return new RangeFilter(key, min, max);
    }

    private static InFilter inFilter(String key, Object rawValues) {
        validateKey(key);
        if (!(rawValues instanceof Collection<?> collection) || collection.isEmpty()) {
            throw new InvalidFilterException("in filter on '" + key + "' needs a non-empty values list");
        }
        List<Object> values = new ArrayList<>(collection.size());
        for (Object value : collection) {
            if (!MetadataValues.isScalar(value)) {
                throw new InvalidFilterException("in filter on '" + key + "' has a non-scalar value");
            }
            values.add(value);
        }
        return new InFilter(key, values);
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank() || !KEY_PATTERN.matcher(key).matches()) {
            throw new InvalidFilterException("invalid filter key: " + key);
        }
    }
}
