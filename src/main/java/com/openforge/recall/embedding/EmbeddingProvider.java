package com.openforge.recall.embedding;

/**
 * Turns query text into a vector in the same space as the stored embeddings.
 */
public interface EmbeddingProvider {

    /**
     * @throws IllegalArgumentException for blank text
     * @throws EmbeddingClient.EmbeddingException when the provider fails
     */
    float[] embed(String text);
}
