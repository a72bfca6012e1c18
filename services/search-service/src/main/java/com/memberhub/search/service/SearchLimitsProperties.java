package com.memberhub.search.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.limits")
public class SearchLimitsProperties {
    private int defaultLimit = 10;
    private int maxLimit = 100;
    private double defaultMinSimilarity = 0.7;
    private int defaultRecommendationLimit = 5;

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public double getDefaultMinSimilarity() {
        return defaultMinSimilarity;
    }

    public void setDefaultMinSimilarity(double defaultMinSimilarity) {
        this.defaultMinSimilarity = defaultMinSimilarity;
    }

    public int getDefaultRecommendationLimit() {
        return defaultRecommendationLimit;
    }

    public void setDefaultRecommendationLimit(int defaultRecommendationLimit) {
        this.defaultRecommendationLimit = defaultRecommendationLimit;
    }

    public int resolveLimit(Integer requested, int fallback) {
        if (requested == null) {
            return Math.min(fallback, maxLimit);
        }
        if (requested < 0) {
            throw new InvalidSearchRequestException("limit must be >= 0");
        }
        return Math.min(requested, maxLimit);
    }
}
