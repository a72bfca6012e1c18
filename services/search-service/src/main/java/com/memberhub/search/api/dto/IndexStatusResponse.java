package com.memberhub.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

public class IndexStatusResponse {
    private int dimension;
    private int items;

    @JsonProperty("items_by_type")
    private Map<String, Integer> itemsByType;

    private int vectors;

    @JsonProperty("lexical_documents")
    private int lexicalDocuments;

    private Ann ann;

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public int getItems() {
        return items;
    }

    public void setItems(int items) {
        this.items = items;
    }

    public Map<String, Integer> getItemsByType() {
        return itemsByType;
    }

    public void setItemsByType(Map<String, Integer> itemsByType) {
        this.itemsByType = itemsByType;
    }

    public int getVectors() {
        return vectors;
    }

    public void setVectors(int vectors) {
        this.vectors = vectors;
    }

    public int getLexicalDocuments() {
        return lexicalDocuments;
    }

    public void setLexicalDocuments(int lexicalDocuments) {
        this.lexicalDocuments = lexicalDocuments;
    }

    public Ann getAnn() {
        return ann;
    }

    public void setAnn(Ann ann) {
        this.ann = ann;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Ann {
        private boolean enabled;
        private boolean rebuilding;
        private long generation;
        private int size;

        @JsonProperty("pending_vectors")
        private int pendingVectors;

        @JsonProperty("built_at")
        private Instant builtAt;

        @JsonProperty("last_build_ms")
        private Long lastBuildMs;

        @JsonProperty("last_error")
        private String lastError;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRebuilding() {
            return rebuilding;
        }

        public void setRebuilding(boolean rebuilding) {
            this.rebuilding = rebuilding;
        }

        public long getGeneration() {
            return generation;
        }

        public void setGeneration(long generation) {
            this.generation = generation;
        }

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getPendingVectors() {
            return pendingVectors;
        }

        public void setPendingVectors(int pendingVectors) {
            this.pendingVectors = pendingVectors;
        }

        public Instant getBuiltAt() {
            return builtAt;
        }

        public void setBuiltAt(Instant builtAt) {
            this.builtAt = builtAt;
        }

        public Long getLastBuildMs() {
            return lastBuildMs;
        }

        public void setLastBuildMs(Long lastBuildMs) {
            this.lastBuildMs = lastBuildMs;
        }

        public String getLastError() {
            return lastError;
        }

        public void setLastError(String lastError) {
            this.lastError = lastError;
        }
    }
}
