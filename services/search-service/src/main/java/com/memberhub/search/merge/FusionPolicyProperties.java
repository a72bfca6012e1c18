package com.memberhub.search.merge;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.fusion")
public class FusionPolicyProperties {
    private String defaultMethod = "weighted";
    private double defaultKeywordWeight = 0.5;
    private double defaultSemanticWeight = 0.5;
    private int rrfK = 60;
    private int candidateMultiplier = 5;
    private int minCandidates = 100;
    private int maxCandidates = 1000;

    public String getDefaultMethod() {
        return defaultMethod;
    }

    public void setDefaultMethod(String defaultMethod) {
        this.defaultMethod = defaultMethod;
    }

    public double getDefaultKeywordWeight() {
        return defaultKeywordWeight;
    }

    public void setDefaultKeywordWeight(double defaultKeywordWeight) {
        this.defaultKeywordWeight = defaultKeywordWeight;
    }

    public double getDefaultSemanticWeight() {
        return defaultSemanticWeight;
    }

    public void setDefaultSemanticWeight(double defaultSemanticWeight) {
        this.defaultSemanticWeight = defaultSemanticWeight;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public int getCandidateMultiplier() {
        return candidateMultiplier;
    }

    public void setCandidateMultiplier(int candidateMultiplier) {
        this.candidateMultiplier = candidateMultiplier;
    }

    public int getMinCandidates() {
        return minCandidates;
    }

    public void setMinCandidates(int minCandidates) {
        this.minCandidates = minCandidates;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public void setMaxCandidates(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public int candidatesFor(int limit) {
        long scaled = (long) Math.max(1, limit) * Math.max(1, candidateMultiplier);
        long bounded = Math.max(scaled, minCandidates);
        return (int) Math.max(limit, Math.min(bounded, Math.max(minCandidates, maxCandidates)));
    }
}
