package com.memberhub.search.merge;

import java.util.Locale;

/**
 * How the lexical and semantic lists are combined. {@link #WEIGHTED} adds the raw scores
 * even though they live on different scales; the other two methods put both sides on a
 * common scale first.
 */
public enum FusionMethod {
    WEIGHTED("weighted"),
    NORMALIZED("normalized"),
    RRF("rrf");

    private final String tag;

    FusionMethod(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static FusionMethod fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "weighted", "linear", "raw" -> WEIGHTED;
            case "normalized", "normalize", "min_max", "minmax" -> NORMALIZED;
            case "rrf", "reciprocal_rank", "reciprocal_rank_fusion" -> RRF;
            default -> null;
        };
    }
}
