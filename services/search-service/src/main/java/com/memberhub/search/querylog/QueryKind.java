package com.memberhub.search.querylog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum QueryKind {
    LEXICAL("lexical"),
    SEMANTIC("semantic"),
    HYBRID("hybrid");

    private final String tag;

    QueryKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static QueryKind fromTag(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("keyword")) {
            return LEXICAL;
        }
        for (QueryKind kind : values()) {
            if (kind.tag.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
