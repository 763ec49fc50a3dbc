package com.openforge.recall.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * application.yml:
 *
 * recall:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:sk-placeholder}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     timeout-seconds: 30
 *
 * The dimension must match {@code recall.milvus.vector-dimensions}.
 */
@ConfigurationProperties(prefix = "recall.embedding")
public record EmbeddingProperties(
        @DefaultValue("https://api.openai.com/v1") String baseUrl,
        @DefaultValue("sk-placeholder")            String apiKey,
        @DefaultValue("text-embedding-3-small")    String model,
        @DefaultValue("1536")                      int    dimensions,
        @DefaultValue("30")                        int    timeoutSeconds,
        @DefaultValue("8000")                      int    maxInputChars
) {}
