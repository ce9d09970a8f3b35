package com.querybim.classify.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querybim.classify.model.Embedding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Service
public class GeminiEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiEmbeddingClient.class);
    private static final String API_KEY_HEADER = "x-goog-api-key";
    private static final int MAX_LOGGED_BODY_CHARS = 300;

    // 100 texts at 768 dimensions come back as roughly 1.6MB of JSON
    public static final int DEFAULT_MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final long requestTimeoutMs;

    @Autowired
    public GeminiEmbeddingClient(
            @Value("${embedding.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${embedding.api-key:}") String apiKey,
            @Value("${embedding.model:models/text-embedding-004}") String model,
            @Value("${embedding.request-timeout-ms:10000}") long requestTimeoutMs,
            @Value("${embedding.max-response-bytes:16777216}") int maxResponseBytes,
            ObjectMapper objectMapper
    ) {
        this(
                WebClient.builder()
                        .baseUrl(baseUrl)
                        .defaultHeader(API_KEY_HEADER, apiKey == null ? "" : apiKey)
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxResponseBytes))
                        .build(),
                model,
                requestTimeoutMs,
                objectMapper
        );
    }

    public GeminiEmbeddingClient(WebClient webClient, String model, long requestTimeoutMs, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.model = model;
        this.requestTimeoutMs = Math.max(100L, requestTimeoutMs);
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Embedding> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        try {
            String response = webClient.post()
                    .uri("/v1beta/" + model + ":batchEmbedContents")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(objectMapper.writeValueAsBytes(buildRequestBody(texts)))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(requestTimeoutMs));
            return parseEmbeddings(response, texts.size());
        } catch (WebClientResponseException ex) {
            log.warn(
                    "embedding batch failed size={} status={} body=\"{}\" cause={}",
                    texts.size(),
                    ex.getStatusCode().value(),
                    truncate(ex.getResponseBodyAsString()),
                    ex.getCause() == null ? "none" : ex.getCause().toString()
            );
        } catch (Exception ex) {
            log.warn("embedding batch failed size={} cause={}", texts.size(), ex.toString());
        }
        return failedBatch(texts.size());
    }

    private Map<String, Object> buildRequestBody(List<String> texts) {
        List<Map<String, Object>> requests = new ArrayList<>(texts.size());
        for (String text : texts) {
            requests.add(Map.of(
                    "model", model,
                    "content", Map.of("parts", List.of(Map.of("text", text == null ? "" : text)))
            ));
        }
        return Map.of("requests", requests);
    }

    private List<Embedding> parseEmbeddings(String response, int expected) throws IOException {
        if (response == null || response.isBlank()) {
            log.warn("embedding batch failed size={} cause=empty_response", expected);
            return failedBatch(expected);
        }
        JsonNode embeddingsNode = objectMapper.readTree(response).path("embeddings");
        if (!embeddingsNode.isArray()) {
            log.warn("embedding batch failed size={} cause=missing_embeddings", expected);
            return failedBatch(expected);
        }
        if (embeddingsNode.size() != expected) {
            log.warn(
                    "embedding batch failed size={} cause=count_mismatch received={}",
                    expected,
                    embeddingsNode.size()
            );
            return failedBatch(expected);
        }

        List<Embedding> embeddings = new ArrayList<>(expected);
        for (JsonNode node : embeddingsNode) {
            embeddings.add(toEmbedding(node.path("values")));
        }
        return embeddings;
    }

    // A single unusable vector only fails its own query.
    private static Embedding toEmbedding(JsonNode valuesNode) {
        if (!valuesNode.isArray() || valuesNode.isEmpty()) {
            return Embedding.failed();
        }
        List<Double> values = new ArrayList<>(valuesNode.size());
        for (JsonNode value : valuesNode) {
            if (!value.isNumber()) {
                return Embedding.failed();
            }
            values.add(value.asDouble());
        }
        return Embedding.of(values);
    }

    private static List<Embedding> failedBatch(int size) {
        return new ArrayList<>(Collections.nCopies(size, Embedding.failed()));
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() > MAX_LOGGED_BODY_CHARS ? flat.substring(0, MAX_LOGGED_BODY_CHARS) + "..." : flat;
    }
}
