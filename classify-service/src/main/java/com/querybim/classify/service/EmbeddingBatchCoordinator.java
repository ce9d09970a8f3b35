package com.querybim.classify.service;

import com.querybim.classify.model.Embedding;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Service
public class EmbeddingBatchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingBatchCoordinator.class);

    public static final int DEFAULT_BATCH_SIZE = 100;

    private final EmbeddingClient embeddingClient;
    private final Executor fanoutExecutor;
    private final int batchSize;
    private final MeterRegistry meterRegistry;

    public EmbeddingBatchCoordinator(EmbeddingClient embeddingClient, Executor fanoutExecutor, int batchSize) {
        this(embeddingClient, fanoutExecutor, batchSize, null);
    }

    @Autowired
    public EmbeddingBatchCoordinator(
            EmbeddingClient embeddingClient,
            @Qualifier("embeddingFanoutExecutor") Executor fanoutExecutor,
            @Value("${embedding.batch-size:100}") int batchSize,
            MeterRegistry meterRegistry
    ) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("embedding.batch-size must be positive, was " + batchSize);
        }
        this.embeddingClient = embeddingClient;
        this.fanoutExecutor = fanoutExecutor;
        this.batchSize = batchSize;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Embeds every text, one provider call per chunk, all chunks in flight at once.
     * The result is aligned with {@code texts}; a failed chunk only marks its own texts
     * as failed.
     */
    public List<Embedding> embedAll(List<String> texts, String traceId) {
        List<List<String>> chunks = QueryChunker.chunk(texts, batchSize);
        if (chunks.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<List<Embedding>>> futures = new ArrayList<>(chunks.size());
        for (int chunkIndex = 0; chunkIndex < chunks.size(); chunkIndex++) {
            futures.add(submitChunk(chunks.get(chunkIndex), chunkIndex, traceId));
        }
        // every future is completed normally by submitChunk, so this waits for all of them
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Embedding> embeddings = new ArrayList<>(texts.size());
        int failedChunks = 0;
        for (CompletableFuture<List<Embedding>> future : futures) {
            List<Embedding> chunkResult = future.join();
            if (chunkResult.stream().noneMatch(Embedding::isPresent)) {
                failedChunks++;
            }
            embeddings.addAll(chunkResult);
        }

        long failedQueries = embeddings.stream().filter(e -> !e.isPresent()).count();
        incrementCounter("embedding_chunk_failure_total", failedChunks);
        incrementCounter("embedding_query_failure_total", failedQueries);
        log.info(
                "trace_id={} stage=embedding chunks={} failed_chunks={} queries={} failed_queries={}",
                traceId,
                chunks.size(),
                failedChunks,
                texts.size(),
                failedQueries
        );
        return embeddings;
    }

    private CompletableFuture<List<Embedding>> submitChunk(List<String> chunk, int chunkIndex, String traceId) {
        CompletableFuture<List<Embedding>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> embeddingClient.embedBatch(chunk), fanoutExecutor);
        } catch (RejectedExecutionException ex) {
            log.warn("trace_id={} stage=embedding chunk={} outcome=REJECTED cause={}", traceId, chunkIndex, ex.toString());
            return CompletableFuture.completedFuture(failedChunk(chunk.size()));
        }
        return future.handle((result, error) -> {
            if (error != null) {
                Throwable cause = error.getCause() == null ? error : error.getCause();
                log.warn("trace_id={} stage=embedding chunk={} outcome=ERROR cause={}", traceId, chunkIndex, cause.toString());
                return failedChunk(chunk.size());
            }
            if (result == null || result.size() != chunk.size()) {
                log.warn(
                        "trace_id={} stage=embedding chunk={} outcome=SIZE_MISMATCH expected={} received={}",
                        traceId,
                        chunkIndex,
                        chunk.size(),
                        result == null ? 0 : result.size()
                );
                return failedChunk(chunk.size());
            }
            List<Embedding> sanitized = new ArrayList<>(result.size());
            for (Embedding embedding : result) {
                sanitized.add(embedding == null ? Embedding.failed() : embedding);
            }
            return sanitized;
        });
    }

    private static List<Embedding> failedChunk(int size) {
        return Collections.nCopies(size, Embedding.failed());
    }

    private void incrementCounter(String metricName, double amount) {
        if (meterRegistry == null || amount <= 0) {
            return;
        }
        meterRegistry.counter(metricName).increment(amount);
    }
}
