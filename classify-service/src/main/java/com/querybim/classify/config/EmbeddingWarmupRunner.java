package com.querybim.classify.config;

import com.querybim.classify.model.Embedding;
import com.querybim.classify.service.EmbeddingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EmbeddingWarmupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingWarmupRunner.class);

    private final EmbeddingClient embeddingClient;
    private final boolean warmupEnabled;
    private final String warmupQuery;
    private final int warmupAttempts;
    private final long warmupDelayMs;

    public EmbeddingWarmupRunner(
            EmbeddingClient embeddingClient,
            @Value("${classify.warmup.enabled:false}") boolean warmupEnabled,
            @Value("${classify.warmup.query:fire door}") String warmupQuery,
            @Value("${classify.warmup.attempts:2}") int warmupAttempts,
            @Value("${classify.warmup.delay-ms:2000}") long warmupDelayMs
    ) {
        this.embeddingClient = embeddingClient;
        this.warmupEnabled = warmupEnabled;
        this.warmupQuery = warmupQuery;
        this.warmupAttempts = Math.max(1, warmupAttempts);
        this.warmupDelayMs = Math.max(0L, warmupDelayMs);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!warmupEnabled) {
            return;
        }

        for (int attempt = 1; attempt <= warmupAttempts; attempt++) {
            List<Embedding> probe = embeddingClient.embedBatch(List.of(warmupQuery));
            if (!probe.isEmpty() && probe.get(0).isPresent()) {
                log.info("embedding warmup completed attempt={} dimensions={}", attempt, probe.get(0).values().size());
                return;
            }
            log.warn("embedding warmup attempt={} returned no embedding", attempt);
            if (attempt < warmupAttempts && warmupDelayMs > 0) {
                try {
                    Thread.sleep(warmupDelayMs);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
