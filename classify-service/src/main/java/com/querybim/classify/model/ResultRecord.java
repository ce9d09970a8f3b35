package com.querybim.classify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ResultRecord {
    @JsonProperty("request_id")
    private long requestId;
    private String match;
    private double confidence;

    public ResultRecord() {
    }

    public ResultRecord(long requestId, String match, double confidence) {
        this.requestId = requestId;
        this.match = match;
        this.confidence = confidence;
    }

    public long getRequestId() {
        return requestId;
    }

    public void setRequestId(long requestId) {
        this.requestId = requestId;
    }

    public String getMatch() {
        return match;
    }

    public void setMatch(String match) {
        this.match = match;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }
}
