package com.openforge.recall.embedding;

import java.util.List;

/**
 * Response from POST /embeddings.
 *
 * {
 *   "object": "list",
 *   "data": [ { "object": "embedding", "index": 0, "embedding": [0.1, -0.2, ...] } ],
 *   "model": "text-embedding-3-small",
 *   "usage": { "prompt_tokens": 8, "total_tokens": 8 }
 * }
 */
public record EmbeddingResponse(
        String              object,
        List<EmbeddingData> data,
        String              model,
        Usage               usage
) {

    /** The vector of the first (and only) input. */
    public List<Float> firstEmbedding() {
        if (data == null || data.isEmpty() || data.get(0).embedding() == null) {
            throw new IllegalStateException("Embedding response contained no data");
        }
        return data.get(0).embedding();
    }

    public record EmbeddingData(String object, int index, List<Float> embedding) {}

    public record Usage(int promptTokens, int totalTokens) {}
}
