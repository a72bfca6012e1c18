package com.memberhub.search.filter;

import java.math.BigDecimal;
import java.util.Map;

final class MetadataValues {
    private MetadataValues() {
    }

    // literal key first, then a dotted path into nested maps
    static Object lookup(Map<String, Object> metadata, String key) {
        if (metadata.containsKey(key) || key.indexOf('.') < 0) {
            return metadata.get(key);
        }
        Object current = metadata;
        for (String segment : key.split("\\.", -1)) {
            if (!(current instanceof Map<?, ?> nested)) {
                return null;
            }
            current = nested.get(segment);
        }
        return current;
    }

    static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    static boolean sameValue(Object stored, Object expected) {
        if (stored == null || expected == null) {
            return false;
        }
        if (stored instanceof Number left && expected instanceof Number right) {
            return toDecimal(left).compareTo(toDecimal(right)) == 0;
        }
        if (stored instanceof Number || expected instanceof Number) {
            return false;
        }
        return stored.equals(expected);
    }

    static Integer compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return toDecimal(l).compareTo(toDecimal(r));
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        return null;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }
}
