package com.querybim.classify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ClassifyQuery {
    @JsonProperty("request_id")
    private Long requestId;
    private String query;
    @JsonProperty("uniclass_type")
    private String uniclassType;
    private Integer depth;

    public ClassifyQuery() {
    }

    public ClassifyQuery(Long requestId, String query, String uniclassType, Integer depth) {
        this.requestId = requestId;
        this.query = query;
        this.uniclassType = uniclassType;
        this.depth = depth;
    }

    public Long getRequestId() {
        return requestId;
    }

    public void setRequestId(Long requestId) {
        this.requestId = requestId;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getUniclassType() {
        return uniclassType;
    }

    public void setUniclassType(String uniclassType) {
        this.uniclassType = uniclassType;
    }

    public Integer getDepth() {
        return depth;
    }

    public void setDepth(Integer depth) {
        this.depth = depth;
    }
}
