package com.memberhub.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RecordClickRequest {
    @JsonProperty("content_id")
    private String contentId;

    public String getContentId() {
        return contentId;
    }

    public void setContentId(String contentId) {
        this.contentId = contentId;
    }
}
