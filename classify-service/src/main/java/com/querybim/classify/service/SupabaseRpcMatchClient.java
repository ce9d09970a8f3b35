package com.querybim.classify.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querybim.classify.model.BackendMatch;
import com.querybim.classify.model.BatchMatchPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;

/**
 * Calls the match function through the Supabase PostgREST endpoint
 * {@code POST /rest/v1/rpc/<function>}.
 */
public class SupabaseRpcMatchClient implements SimilarityMatchClient {

    private static final Logger log = LoggerFactory.getLogger(SupabaseRpcMatchClient.class);
    private static final TypeReference<List<BackendMatch>> MATCH_LIST = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String functionName;
    private final long requestTimeoutMs;

    public SupabaseRpcMatchClient(
            String supabaseUrl,
            String apiKey,
            String functionName,
            long requestTimeoutMs,
            int maxResponseBytes,
            ObjectMapper objectMapper
    ) {
        this(
                WebClient.builder()
                        .baseUrl(supabaseUrl)
                        .defaultHeader("apikey", apiKey == null ? "" : apiKey)
                        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (apiKey == null ? "" : apiKey))
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxResponseBytes))
                        .build(),
                functionName,
                requestTimeoutMs,
                objectMapper
        );
    }

    public SupabaseRpcMatchClient(WebClient webClient, String functionName, long requestTimeoutMs, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.functionName = functionName;
        this.requestTimeoutMs = Math.max(100L, requestTimeoutMs);
        this.objectMapper = objectMapper;
    }

    @Override
    public List<BackendMatch> batchMatch(BatchMatchPayload payload) {
        String body;
        try {
            body = webClient.post()
                    .uri("/rest/v1/rpc/{function}", functionName)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(objectMapper.writeValueAsBytes(payload))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(requestTimeoutMs));
        } catch (WebClientResponseException ex) {
            String message = extractErrorMessage(ex);
            log.warn(
                    "rpc {} failed status={} message=\"{}\" cause={}",
                    functionName,
                    ex.getStatusCode().value(),
                    message,
                    ex.getCause() == null ? "none" : ex.getCause().toString()
            );
            throw new MatchBackendException(message, ex);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("could not serialize batch match payload", ex);
        } catch (RuntimeException ex) {
            log.warn("rpc {} failed cause={}", functionName, ex.toString());
            throw new MatchBackendException(describe(ex), ex);
        }
        return parseMatches(body);
    }

    private List<BackendMatch> parseMatches(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            List<BackendMatch> matches = objectMapper.readValue(body, MATCH_LIST);
            return matches == null ? List.of() : matches;
        } catch (JsonProcessingException ex) {
            throw new MatchBackendException("Unreadable response from " + functionName + ": " + ex.getOriginalMessage(), ex);
        }
    }

    // PostgREST errors look like {"code":"...","message":"...","details":...,"hint":...}
    private String extractErrorMessage(WebClientResponseException ex) {
        String responseBody = ex.getResponseBodyAsString();
        if (responseBody != null && !responseBody.isBlank()) {
            try {
                JsonNode message = objectMapper.readTree(responseBody).path("message");
                if (message.isTextual() && !message.asText().isBlank()) {
                    return message.asText();
                }
            } catch (JsonProcessingException ignored) {
                return responseBody.trim();
            }
        }
        return ex.getStatusCode().value() + " " + ex.getStatusText();
    }

    private static String describe(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }
}
