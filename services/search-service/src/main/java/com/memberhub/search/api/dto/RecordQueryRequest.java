package com.memberhub.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public class RecordQueryRequest {
    @JsonProperty("member_id")
    private String memberId;

    @JsonProperty("query_text")
    private String queryText;

    @JsonProperty("query_kind")
    private String queryKind;

    private List<Map<String, Object>> filters;

    @JsonProperty("result_count")
    private Integer resultCount;

    @JsonProperty("top_result_id")
    private String topResultId;

    @JsonProperty("top_result_score")
    private Double topResultScore;

    @JsonProperty("latency_ms")
    private Long latencyMs;

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

    public List<Map<String, Object>> getFilters() {
        return filters;
    }

    public void setFilters(List<Map<String, Object>> filters) {
        this.filters = filters;
    }

    public Integer getResultCount() {
        return resultCount;
    }

    public void setResultCount(Integer resultCount) {
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

    public Long getLatencyMs() {
        return latencyMs;
    }

    public void setLatencyMs(Long latencyMs) {
        this.latencyMs = latencyMs;
    }
}
