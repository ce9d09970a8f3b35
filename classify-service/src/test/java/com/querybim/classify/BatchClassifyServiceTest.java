package com.querybim.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querybim.classify.model.BackendMatch;
import com.querybim.classify.model.BatchMatchPayload;
import com.querybim.classify.model.ClassifyQuery;
import com.querybim.classify.model.Embedding;
import com.querybim.classify.model.ResolvedQuery;
import com.querybim.classify.model.ResultRecord;
import com.querybim.classify.service.BatchClassifyService;
import com.querybim.classify.service.EmbeddingBatchCoordinator;
import com.querybim.classify.service.EmbeddingClient;
import com.querybim.classify.service.InvalidBatchRequestException;
import com.querybim.classify.service.MatchBackendException;
import com.querybim.classify.service.MatchRequester;
import com.querybim.classify.service.ResultReconciler;
import com.querybim.classify.service.SimilarityMatchClient;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchClassifyServiceTest {

    private final SimilarityMatchClient matchClient = mock(SimilarityMatchClient.class);
    private final AtomicInteger embeddingCalls = new AtomicInteger();

    private BatchClassifyService service(EmbeddingClient embeddingClient, int batchSize) {
        EmbeddingBatchCoordinator coordinator = new EmbeddingBatchCoordinator(embeddingClient, Runnable::run, batchSize);
        return new BatchClassifyService(
                coordinator,
                new MatchRequester(matchClient, new ObjectMapper()),
                new ResultReconciler()
        );
    }

    private EmbeddingClient workingEmbeddings() {
        return texts -> {
            embeddingCalls.incrementAndGet();
            return texts.stream().map(t -> Embedding.of(List.of(0.1, 0.2))).collect(Collectors.toList());
        };
    }

    private static ClassifyQuery query(String text) {
        return new ClassifyQuery(null, text, "pr", null);
    }

    @Test
    void testMatchAndNoMatchExample() {
        when(matchClient.batchMatch(any())).thenReturn(List.of(new BackendMatch(0, "C10", "Doors", 0.873)));

        List<ResultRecord> results = service(workingEmbeddings(), 100)
                .classify(List.of(query("fire door"), query("xyzzy-nonsense")));

        assertThat(results).hasSize(2);
        assertThat(results.get(0).getRequestId()).isEqualTo(0L);
        assertThat(results.get(0).getMatch()).isEqualTo("C10:Doors:0.87");
        assertThat(results.get(0).getConfidence()).isEqualTo(0.873);
        assertThat(results.get(1).getRequestId()).isEqualTo(1L);
        assertThat(results.get(1).getMatch()).isEqualTo("No match found:0.00");
        assertThat(results.get(1).getConfidence()).isEqualTo(0.0);
    }

    @Test
    void testExplicitIdsDepthAndTypeAreForwarded() {
        when(matchClient.batchMatch(any())).thenReturn(List.of());

        service(workingEmbeddings(), 100).classify(List.of(
                new ClassifyQuery(501L, "fire door", "Pr", 4),
                new ClassifyQuery(null, "steel beam", "ss", null)
        ));

        ArgumentCaptor<BatchMatchPayload> captor = ArgumentCaptor.forClass(BatchMatchPayload.class);
        verify(matchClient).batchMatch(captor.capture());
        BatchMatchPayload payload = captor.getValue();
        assertThat(payload.requestIds()).containsExactly(501L, 1L);
        assertThat(payload.uniclassTypeFilters()).containsExactly("PR", "SS");
        assertThat(payload.depths()).containsExactly(4, 2);
        assertThat(payload.queryEmbeddings()).containsOnly("[0.1,0.2]");
    }

    @Test
    void testFailedChunkIsReportedAndNeverSentToBackend() {
        EmbeddingClient flaky = texts -> texts.contains("broken")
                ? texts.stream().map(t -> Embedding.failed()).collect(Collectors.toList())
                : texts.stream().map(t -> Embedding.of(List.of(0.3))).collect(Collectors.toList());
        when(matchClient.batchMatch(any())).thenReturn(List.of(new BackendMatch(0, "A", "Alpha", 0.5)));

        List<ResultRecord> results = service(flaky, 2).classify(List.of(
                query("alpha"), query("beta"), query("broken"), query("delta")
        ));

        assertThat(results).extracting(ResultRecord::getMatch).containsExactly(
                "A:Alpha:0.50", "No match found:0.00", "Embedding failed:0.00", "Embedding failed:0.00");
        assertThat(results).extracting(ResultRecord::getRequestId).containsExactly(0L, 1L, 2L, 3L);

        ArgumentCaptor<BatchMatchPayload> captor = ArgumentCaptor.forClass(BatchMatchPayload.class);
        verify(matchClient).batchMatch(captor.capture());
        assertThat(captor.getValue().requestIds()).containsExactly(0L, 1L);
    }

    @Test
    void testOutputLengthMatchesLargeInput() {
        when(matchClient.batchMatch(any())).thenReturn(List.of());
        List<ClassifyQuery> queries = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            queries.add(query("item " + i));
        }

        List<ResultRecord> results = service(workingEmbeddings(), 100).classify(queries);

        assertThat(results).hasSize(250);
        assertThat(results.get(249).getRequestId()).isEqualTo(249L);
        assertThat(embeddingCalls.get()).isEqualTo(3);
    }

    @Test
    void testEmptyBatchIsRejectedBeforeAnyCall() {
        BatchClassifyService service = service(workingEmbeddings(), 100);

        assertThatThrownBy(() -> service.classify(List.of()))
                .isInstanceOf(InvalidBatchRequestException.class)
                .hasMessage(BatchClassifyService.INVALID_QUERIES);
        assertThatThrownBy(() -> service.classify(null))
                .isInstanceOf(InvalidBatchRequestException.class);
        assertThat(embeddingCalls.get()).isZero();
        verify(matchClient, never()).batchMatch(any());
    }

    @Test
    void testBackendFailureFailsWholeBatch() {
        when(matchClient.batchMatch(any())).thenThrow(new MatchBackendException("database unreachable"));
        BatchClassifyService service = service(workingEmbeddings(), 100);

        assertThatThrownBy(() -> service.classify(List.of(query("fire door"))))
                .isInstanceOf(MatchBackendException.class)
                .hasMessage("database unreachable");
        assertThat(embeddingCalls.get()).isEqualTo(1);
    }

    @Test
    void testResolveQueriesAppliesDefaults() {
        List<ResolvedQuery> resolved = BatchClassifyService.resolveQueries(List.of(
                new ClassifyQuery(null, "a", "en", null),
                new ClassifyQuery(0L, "b", "Ss", 1)
        ));

        assertThat(resolved.get(0).requestId()).isEqualTo(0L);
        assertThat(resolved.get(0).depth()).isEqualTo(BatchClassifyService.DEFAULT_DEPTH);
        assertThat(resolved.get(0).uniclassType()).isEqualTo("EN");
        assertThat(resolved.get(1).requestId()).isEqualTo(0L);
        assertThat(resolved.get(1).position()).isEqualTo(1);
        assertThat(resolved.get(1).depth()).isEqualTo(1);
    }

    @Test
    void testMissingUniclassTypeIsRejected() {
        assertThatThrownBy(() -> BatchClassifyService.resolveQueries(List.of(
                new ClassifyQuery(null, "a", "PR", null),
                new ClassifyQuery(null, "b", null, null)
        )))
                .isInstanceOf(InvalidBatchRequestException.class)
                .hasMessageContaining("index 1");
    }

    @Test
    void testBlankUniclassTypeIsAccepted() {
        List<ResolvedQuery> resolved = BatchClassifyService.resolveQueries(List.of(
                new ClassifyQuery(null, "fire door", "", null),
                new ClassifyQuery(null, "steel beam", " pr", null)
        ));

        assertThat(resolved).extracting(ResolvedQuery::uniclassType).containsExactly("", " PR");
    }
}
