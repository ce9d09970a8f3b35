package com.querybim.classify;

import com.querybim.classify.config.EmbeddingWarmupRunner;
import com.querybim.classify.model.Embedding;
import com.querybim.classify.service.EmbeddingClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmbeddingWarmupRunnerTest {

    private final EmbeddingClient embeddingClient = mock(EmbeddingClient.class);

    @Test
    void testDisabledWarmupMakesNoCalls() {
        new EmbeddingWarmupRunner(embeddingClient, false, "fire door", 2, 0)
                .run(new DefaultApplicationArguments());

        verify(embeddingClient, never()).embedBatch(anyList());
    }

    @Test
    void testWarmupStopsAfterFirstEmbedding() {
        when(embeddingClient.embedBatch(List.of("fire door")))
                .thenReturn(List.of(Embedding.of(List.of(0.1, 0.2))));

        new EmbeddingWarmupRunner(embeddingClient, true, "fire door", 3, 0)
                .run(new DefaultApplicationArguments());

        verify(embeddingClient, times(1)).embedBatch(List.of("fire door"));
    }

    @Test
    void testWarmupRetriesUntilAttemptsExhausted() {
        when(embeddingClient.embedBatch(List.of("fire door")))
                .thenReturn(List.of(Embedding.failed()));

        new EmbeddingWarmupRunner(embeddingClient, true, "fire door", 2, 0)
                .run(new DefaultApplicationArguments());

        verify(embeddingClient, times(2)).embedBatch(List.of("fire door"));
    }
}
