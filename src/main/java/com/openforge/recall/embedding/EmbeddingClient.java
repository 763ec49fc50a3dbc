package com.openforge.recall.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.recall.candidate.Vectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Turns a recall query into its query vector through an OpenAI-compatible
 * /embeddings endpoint. Shared HttpClient plus Jackson, no vendor SDK.
 *
 * One call per query. Every failure surfaces as {@link EmbeddingException} so the
 * retrieval facade can report it without touching the store.
 */
@Slf4j
@Component
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingClient implements EmbeddingProvider {

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @param text the query; anything past {@code maxInputChars} is cut off before sending
     * @return a vector with only finite components
     */
    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        String query = text.length() > props.maxInputChars()
                ? text.substring(0, props.maxInputChars())
                : text;

        log.debug("[Embed] → query vector model={} chars={}", props.model(), query.length());
        float[] vector = decode(exchange(requestFor(query)));
        log.debug("[Embed] ← query vector dim={}", vector.length);
        return vector;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest requestFor(String query) {
        String json;
        try {
            json = objectMapper.writeValueAsString(EmbeddingRequest.of(query, props.model(), props.dimensions()));
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Could not encode query for embedding", e);
        }
        return HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
    }

    private HttpResponse<String> exchange(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Query embedding cancelled", e);
        } catch (IOException e) {
            throw new EmbeddingException("Embedding endpoint unreachable: " + e.getMessage(), e);
        }
    }

    private float[] decode(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) {
            throw new EmbeddingException("Embedding endpoint rate-limited the query");
        }
        if (status < 200 || status >= 300) {
            throw new EmbeddingException("Embedding endpoint answered HTTP %d: %s".formatted(status, body));
        }

        float[] vector;
        try {
            vector = Vectors.toArray(objectMapper.readValue(body, EmbeddingResponse.class).firstEmbedding());
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new EmbeddingException("Could not parse embedding response: " + body, e);
        }
        if (vector == null) {
            throw new EmbeddingException("Could not parse embedding response: empty or non-finite vector");
        }
        return vector;
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
