package com.querybim.classify.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parallel arrays sent to {@code querybim_batch_match}; index {@code k} of every list
 * describes the same query.
 */
public record BatchMatchPayload(
        @JsonProperty("p_request_ids") List<Long> requestIds,
        @JsonProperty("p_query_embeddings") List<String> queryEmbeddings,
        @JsonProperty("p_uniclass_type_filters") List<String> uniclassTypeFilters,
        @JsonProperty("p_depths") List<Integer> depths
) {
    public BatchMatchPayload {
        requestIds = List.copyOf(requestIds);
        queryEmbeddings = List.copyOf(queryEmbeddings);
        uniclassTypeFilters = List.copyOf(uniclassTypeFilters);
        depths = List.copyOf(depths);
        int size = requestIds.size();
        if (queryEmbeddings.size() != size || uniclassTypeFilters.size() != size || depths.size() != size) {
            throw new IllegalArgumentException("batch match arrays must have equal length");
        }
    }

    public int size() {
        return requestIds.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return requestIds.isEmpty();
    }
}
