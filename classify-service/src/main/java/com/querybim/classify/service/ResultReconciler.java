package com.querybim.classify.service;

import com.querybim.classify.model.BackendMatch;
import com.querybim.classify.model.Embedding;
import com.querybim.classify.model.ResolvedQuery;
import com.querybim.classify.model.ResultRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class ResultReconciler {
    private static final Logger log = LoggerFactory.getLogger(ResultReconciler.class);

    /**
     * Produces exactly one record per query, in query order. Queries without a backend
     * match get a placeholder telling an embedding failure apart from a genuine miss.
     * When the backend returns several matches for one request id the last one wins.
     */
    public List<ResultRecord> reconcile(
            List<ResolvedQuery> queries,
            List<Embedding> embeddings,
            List<BackendMatch> matches
    ) {
        if (queries.size() != embeddings.size()) {
            throw new IllegalArgumentException(
                    "embeddings not aligned with queries: " + embeddings.size() + " != " + queries.size());
        }

        Map<Long, BackendMatch> matchesById = new HashMap<>();
        for (BackendMatch match : matches) {
            if (match == null) {
                continue;
            }
            BackendMatch previous = matchesById.put(match.getRequestId(), match);
            if (previous != null) {
                log.debug("backend returned several matches request_id={} kept_code={}", match.getRequestId(), match.getCode());
            }
        }

        List<ResultRecord> results = new ArrayList<>(queries.size());
        for (int i = 0; i < queries.size(); i++) {
            long requestId = queries.get(i).requestId();
            BackendMatch match = matchesById.get(requestId);
            if (match != null) {
                results.add(new ResultRecord(
                        requestId,
                        MatchTextFormatter.format(match.getCode(), match.getTitle(), match.getSimilarity()),
                        match.getSimilarity()
                ));
            } else if (embeddings.get(i).isPresent()) {
                results.add(new ResultRecord(requestId, MatchTextFormatter.NO_MATCH, 0.0));
            } else {
                results.add(new ResultRecord(requestId, MatchTextFormatter.EMBEDDING_FAILED, 0.0));
            }
        }
        return results;
    }
}
