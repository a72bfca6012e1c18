package com.memberhub.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public class SearchRequest {
    @JsonProperty("query_text")
    private String queryText;

    @JsonProperty("query_vector")
    private float[] queryVector;

    @JsonProperty("content_types")
    private List<String> contentTypes;

    @JsonProperty("metadata_filter")
    private Map<String, Object> metadataFilter;

    private List<Map<String, Object>> filters;
    private Integer limit;

    @JsonProperty("min_similarity")
    private Double minSimilarity;

    @JsonProperty("keyword_weight")
    private Double keywordWeight;

    @JsonProperty("semantic_weight")
    private Double semanticWeight;

    @JsonProperty("fusion_method")
    private String fusionMethod;

    @JsonProperty("member_id")
    private String memberId;

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public float[] getQueryVector() {
        return queryVector;
    }

    public void setQueryVector(float[] queryVector) {
        this.queryVector = queryVector;
    }

    public List<String> getContentTypes() {
        return contentTypes;
    }

    public void setContentTypes(List<String> contentTypes) {
        this.contentTypes = contentTypes;
    }

    public Map<String, Object> getMetadataFilter() {
        return metadataFilter;
    }

    public void setMetadataFilter(Map<String, Object> metadataFilter) {
        this.metadataFilter = metadataFilter;
    }

    public List<Map<String, Object>> getFilters() {
        return filters;
    }

    public void setFilters(List<Map<String, Object>> filters) {
        this.filters = filters;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Double getMinSimilarity() {
        return minSimilarity;
    }

    public void setMinSimilarity(Double minSimilarity) {
        this.minSimilarity = minSimilarity;
    }

    public Double getKeywordWeight() {
        return keywordWeight;
    }

    public void setKeywordWeight(Double keywordWeight) {
        this.keywordWeight = keywordWeight;
    }

    public Double getSemanticWeight() {
        return semanticWeight;
    }

    public void setSemanticWeight(Double semanticWeight) {
        this.semanticWeight = semanticWeight;
    }

    public String getFusionMethod() {
        return fusionMethod;
    }

    public void setFusionMethod(String fusionMethod) {
        this.fusionMethod = fusionMethod;
    }

    public String getMemberId() {
        return memberId;
    }

    public void setMemberId(String memberId) {
        this.memberId = memberId;
    }
}
