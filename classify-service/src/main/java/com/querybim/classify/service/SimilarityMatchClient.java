package com.querybim.classify.service;

import com.querybim.classify.model.BackendMatch;
import com.querybim.classify.model.BatchMatchPayload;

import java.util.List;

public interface SimilarityMatchClient {
    /**
     * Runs one batch match call. Returns zero or more matches per request id, in any order.
     *
     * @throws MatchBackendException if the backend could not be reached or rejected the call
     */
    List<BackendMatch> batchMatch(BatchMatchPayload payload);
}
