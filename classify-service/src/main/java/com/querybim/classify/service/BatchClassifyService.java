package com.querybim.classify.service;

import com.querybim.classify.model.BackendMatch;
import com.querybim.classify.model.ClassifyQuery;
import com.querybim.classify.model.Embedding;
import com.querybim.classify.model.ResolvedQuery;
import com.querybim.classify.model.ResultRecord;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

@Service
public class BatchClassifyService {
    private static final Logger log = LoggerFactory.getLogger(BatchClassifyService.class);

    public static final String INVALID_QUERIES = "Missing or invalid \"queries\" array in request body";
    public static final int DEFAULT_DEPTH = 2;

    private final EmbeddingBatchCoordinator embeddingCoordinator;
    private final MatchRequester matchRequester;
    private final ResultReconciler resultReconciler;
    private final MeterRegistry meterRegistry;

    public BatchClassifyService(
            EmbeddingBatchCoordinator embeddingCoordinator,
            MatchRequester matchRequester,
            ResultReconciler resultReconciler
    ) {
        this(embeddingCoordinator, matchRequester, resultReconciler, null);
    }

    @Autowired
    public BatchClassifyService(
            EmbeddingBatchCoordinator embeddingCoordinator,
            MatchRequester matchRequester,
            ResultReconciler resultReconciler,
            MeterRegistry meterRegistry
    ) {
        this.embeddingCoordinator = embeddingCoordinator;
        this.matchRequester = matchRequester;
        this.resultReconciler = resultReconciler;
        this.meterRegistry = meterRegistry;
    }

    public List<ResultRecord> classify(List<ClassifyQuery> queries) {
        return classify(queries, UUID.randomUUID().toString());
    }

    /**
     * Classifies a batch. The returned list has one record per input query, in input order.
     *
     * @throws InvalidBatchRequestException if the batch is missing, empty or malformed
     * @throws MatchBackendException if the similarity backend call fails
     */
    public List<ResultRecord> classify(List<ClassifyQuery> queries, String traceId) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        long totalStart = System.nanoTime();

        List<ResolvedQuery> resolved;
        try {
            resolved = resolveQueries(queries);
        } catch (InvalidBatchRequestException ex) {
            incrementCounter("INVALID");
            throw ex;
        }
        log.info("trace_id={} event=batch_start queries={}", effectiveTraceId, resolved.size());

        long embeddingStart = System.nanoTime();
        List<String> texts = resolved.stream().map(ResolvedQuery::text).toList();
        List<Embedding> embeddings = embeddingCoordinator.embedAll(texts, effectiveTraceId);
        recordTimer("embedding_stage_latency_ms", embeddingStart);

        long matchStart = System.nanoTime();
        List<BackendMatch> matches;
        try {
            matches = matchRequester.requestMatches(resolved, embeddings);
        } catch (MatchBackendException ex) {
            incrementCounter("BACKEND_ERROR");
            log.warn(
                    "trace_id={} stage=backend_match outcome=ERROR duration_ms={} cause=\"{}\"",
                    effectiveTraceId,
                    elapsedMillis(matchStart),
                    ex.getMessage()
            );
            throw ex;
        } finally {
            recordTimer("backend_match_latency_ms", matchStart);
        }
        log.info(
                "trace_id={} stage=backend_match outcome=SUCCESS duration_ms={} matches={}",
                effectiveTraceId,
                elapsedMillis(matchStart),
                matches.size()
        );

        List<ResultRecord> results = resultReconciler.reconcile(resolved, embeddings, matches);
        incrementCounter("SUCCESS");
        log.info(
                "trace_id={} event=batch_complete total_ms={} processed={}",
                effectiveTraceId,
                elapsedMillis(totalStart),
                results.size()
        );
        return results;
    }

    /**
     * Validates the inbound batch and resolves every optional field.
     */
    public static List<ResolvedQuery> resolveQueries(List<ClassifyQuery> queries) {
        if (queries == null || queries.isEmpty()) {
            throw new InvalidBatchRequestException(INVALID_QUERIES);
        }
        List<ResolvedQuery> resolved = new ArrayList<>(queries.size());
        for (int i = 0; i < queries.size(); i++) {
            ClassifyQuery query = queries.get(i);
            if (query == null) {
                throw invalidQuery(i, "query entry must be an object");
            }
            if (query.getQuery() == null) {
                throw invalidQuery(i, "\"query\" is required");
            }
            if (query.getUniclassType() == null) {
                throw invalidQuery(i, "\"uniclass_type\" is required");
            }
            long requestId = query.getRequestId() == null ? i : query.getRequestId();
            int depth = query.getDepth() == null ? DEFAULT_DEPTH : query.getDepth();
            resolved.add(new ResolvedQuery(
                    i,
                    requestId,
                    query.getQuery(),
                    query.getUniclassType().toUpperCase(Locale.ROOT),
                    depth
            ));
        }
        return resolved;
    }

    private static InvalidBatchRequestException invalidQuery(int index, String details) {
        return new InvalidBatchRequestException("Invalid query at index " + index, details);
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String status) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter("batch_classify_requests_total", "status", status).increment();
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
