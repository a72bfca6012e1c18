package com.memberhub.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryLogEntryDto {
    private String id;

    @JsonProperty("member_id")
    private String memberId;

    @JsonProperty("query_text")
    private String queryText;

    @JsonProperty("query_kind")
    private String queryKind;

    @JsonProperty("applied_filters")
    private List<Map<String, Object>> appliedFilters;

    @JsonProperty("result_count")
    private int resultCount;

    @JsonProperty("top_result_id")
    private String topResultId;

    @JsonProperty("top_result_score")
    private Double topResultScore;

    @JsonProperty("latency_ms")
    private long latencyMs;

    @JsonProperty("clicked_result_ids")
    private List<String> clickedResultIds;

    @JsonProperty("created_at")
    private Instant createdAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getMemberId() {
        return memberId;
    }

    public void setMemberId(String memberId) {
        this.memberId = memberId;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public String getQueryKind() {
        return queryKind;
    }

    public void setQueryKind(String queryKind) {
        this.queryKind = queryKind;
    }

    public List<Map<String, Object>> getAppliedFilters() {
        return appliedFilters;
    }

    public void setAppliedFilters(List<Map<String, Object>> appliedFilters) {
        this.appliedFilters = appliedFilters;
    }

    public int getResultCount() {
        return resultCount;
    }

    public void setResultCount(int resultCount) {
        this.resultCount = resultCount;
    }

    public String getTopResultId() {
        return topResultId;
    }

    public void setTopResultId(String topResultId) {
        this.topResultId = topResultId;
    }

    public Double getTopResultScore() {
        return topResultScore;
    }

    public void setTopResultScore(Double topResultScore) {
        this.topResultScore = topResultScore;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public void setLatencyMs(long latencyMs) {
        this.latencyMs = latencyMs;
    }

    public List<String> getClickedResultIds() {
        return clickedResultIds;
    }

    public void setClickedResultIds(List<String> clickedResultIds) {
        this.clickedResultIds = clickedResultIds;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
