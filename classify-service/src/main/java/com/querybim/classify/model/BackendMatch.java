package com.querybim.classify.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendMatch {
    @JsonProperty("request_id")
    private long requestId;
    private String code;
    private String title;
    private double similarity;

    public BackendMatch() {
    }

    public BackendMatch(long requestId, String code, String title, double similarity) {
        this.requestId = requestId;
        this.code = code;
        this.title = title;
        this.similarity = similarity;
    }

    public long getRequestId() { return requestId; }
    public void setRequestId(long requestId) { this.requestId = requestId; }
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public double getSimilarity() { return similarity; }
    public void setSimilarity(double similarity) { this.similarity = similarity; }
}
