package com.memberhub.search.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.vector")
public class VectorSearchProperties {
    private int exactScanThreshold = 2000;
    private Ann ann = new Ann();

    public int getExactScanThreshold() {
        return exactScanThreshold;
    }

    public void setExactScanThreshold(int exactScanThreshold) {
        this.exactScanThreshold = exactScanThreshold;
    }

    public Ann getAnn() {
        return ann;
    }

    public void setAnn(Ann ann) {
        this.ann = ann;
    }

    public static class Ann {
        private boolean enabled = true;
        private int maxDegree = 16;
        private int beamWidth = 100;
        private float neighborOverflow = 1.2f;
        private float alpha = 1.2f;
        private int candidateListSize = 100;
        private int filteredCandidateMultiplier = 4;
        private long rebuildIntervalMs = 60000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxDegree() {
            return maxDegree;
        }

        public void setMaxDegree(int maxDegree) {
            this.maxDegree = maxDegree;
        }

        public int getBeamWidth() {
            return beamWidth;
        }

        public void setBeamWidth(int beamWidth) {
            this.beamWidth = beamWidth;
        }

        public float getNeighborOverflow() {
            return neighborOverflow;
        }

        public void setNeighborOverflow(float neighborOverflow) {
            this.neighborOverflow = neighborOverflow;
        }

        public float getAlpha() {
            return alpha;
        }

        public void setAlpha(float alpha) {
            this.alpha = alpha;
        }

        public int getCandidateListSize() {
            return candidateListSize;
        }

        public void setCandidateListSize(int candidateListSize) {
            this.candidateListSize = candidateListSize;
        }

        public int getFilteredCandidateMultiplier() {
            return filteredCandidateMultiplier;
        }

        public void setFilteredCandidateMultiplier(int filteredCandidateMultiplier) {
            this.filteredCandidateMultiplier = filteredCandidateMultiplier;
        }

        public long getRebuildIntervalMs() {
            return rebuildIntervalMs;
        }

        public void setRebuildIntervalMs(long rebuildIntervalMs) {
            this.rebuildIntervalMs = rebuildIntervalMs;
        }
    }
}
