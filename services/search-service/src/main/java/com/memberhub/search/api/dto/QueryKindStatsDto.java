package com.memberhub.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class QueryKindStatsDto {
    @JsonProperty("query_kind")
    private String queryKind;

    @JsonProperty("query_count")
    private long queryCount;

    @JsonProperty("average_latency_ms")
    private double averageLatencyMs;

    @JsonProperty("zero_result_count")
    private long zeroResultCount;

    @JsonProperty("clicked_query_count")
    private long clickedQueryCount;

    public String getQueryKind() {
        return queryKind;
    }

    public void setQueryKind(String queryKind) {
        this.queryKind = queryKind;
    }

    public long getQueryCount() {
        return queryCount;
    }

    public void setQueryCount(long queryCount) {
        this.queryCount = queryCount;
    }

    public double getAverageLatencyMs() {
        return averageLatencyMs;
    }

    public void setAverageLatencyMs(double averageLatencyMs) {
        this.averageLatencyMs = averageLatencyMs;
    }

    public long getZeroResultCount() {
        return zeroResultCount;
    }

    public void setZeroResultCount(long zeroResultCount) {
        this.zeroResultCount = zeroResultCount;
    }

    public long getClickedQueryCount() {
        return clickedQueryCount;
    }

    public void setClickedQueryCount(long clickedQueryCount) {
        this.clickedQueryCount = clickedQueryCount;
    }
}
