package com.querybim.classify.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchClassifyResponse {
    private boolean success;
    private Integer processed;
    private List<ResultRecord> results;
    private String error;
    private String details;

    public static BatchClassifyResponse ok(List<ResultRecord> results) {
        BatchClassifyResponse response = new BatchClassifyResponse();
        response.setSuccess(true);
        response.setProcessed(results.size());
        response.setResults(results);
        return response;
    }

    public static BatchClassifyResponse failure(String error, String details) {
        BatchClassifyResponse response = new BatchClassifyResponse();
        response.setSuccess(false);
        response.setError(error);
        response.setDetails(details);
        return response;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public Integer getProcessed() {
        return processed;
    }

    public void setProcessed(Integer processed) {
        this.processed = processed;
    }

    public List<ResultRecord> getResults() {
        return results;
    }

    public void setResults(List<ResultRecord> results) {
        this.results = results;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }
}
