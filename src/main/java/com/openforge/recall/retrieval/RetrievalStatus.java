package com.openforge.recall.retrieval;

/**
 * Coarse quality of a retrieval, for callers deciding whether to trust it.
 */
public enum RetrievalStatus {
    /** Enough results, and the best one is similar enough. */
    OK,
    /** Some results, but fewer than wanted or only weakly similar. */
    THIN,
    /** Nothing came back. */
    NONE;

    public static RetrievalStatus of(int count, double topSimilarity, int minCount, double minSimilarity) {
        if (count <= 0) return NONE;
        if (count < minCount || topSimilarity < minSimilarity) return THIN;
        return OK;
    }
}
