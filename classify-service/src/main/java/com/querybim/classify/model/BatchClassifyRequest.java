package com.querybim.classify.model;

import java.util.List;

public class BatchClassifyRequest {
    private List<ClassifyQuery> queries;

    public BatchClassifyRequest() {
    }

    public BatchClassifyRequest(List<ClassifyQuery> queries) {
        this.queries = queries;
    }

    public List<ClassifyQuery> getQueries() {
        return queries;
    }

    public void setQueries(List<ClassifyQuery> queries) {
        this.queries = queries;
    }
}
