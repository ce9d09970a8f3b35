package com.querybim.classify.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querybim.classify.model.BackendMatch;
import com.querybim.classify.model.BatchMatchPayload;
import com.querybim.classify.model.Embedding;
import com.querybim.classify.model.ResolvedQuery;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class MatchRequester {

    private final SimilarityMatchClient matchClient;
    private final ObjectMapper objectMapper;

    public MatchRequester(SimilarityMatchClient matchClient, ObjectMapper objectMapper) {
        this.matchClient = matchClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Sends every successfully embedded query to the backend in a single call.
     * Queries whose embedding failed are left out of the payload.
     */
    public List<BackendMatch> requestMatches(List<ResolvedQuery> queries, List<Embedding> embeddings) {
        List<BackendMatch> matches = matchClient.batchMatch(buildPayload(queries, embeddings));
        return matches == null ? List.of() : matches;
    }

    public BatchMatchPayload buildPayload(List<ResolvedQuery> queries, List<Embedding> embeddings) {
        if (queries.size() != embeddings.size()) {
            throw new IllegalArgumentException(
                    "embeddings not aligned with queries: " + embeddings.size() + " != " + queries.size());
        }
        List<Long> requestIds = new ArrayList<>();
        List<String> serializedEmbeddings = new ArrayList<>();
        List<String> typeFilters = new ArrayList<>();
        List<Integer> depths = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            Embedding embedding = embeddings.get(i);
            if (!embedding.isPresent()) {
                continue;
            }
            ResolvedQuery query = queries.get(i);
            requestIds.add(query.requestId());
            serializedEmbeddings.add(serialize(embedding));
            typeFilters.add(query.uniclassType());
            depths.add(query.depth());
        }
        return new BatchMatchPayload(requestIds, serializedEmbeddings, typeFilters, depths);
    }

    private String serialize(Embedding embedding) {
        try {
            return objectMapper.writeValueAsString(embedding.values());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("could not serialize embedding", ex);
        }
    }
}
