package com.openforge.recall.arbitration;

/**
 * How two candidates asserting the same thing with close confidence are settled.
 * A confidence gap larger than the configured epsilon always goes to the more
 * confident one, whatever the policy.
 */
public enum ConflictPolicy {
    /** Winner by effective provenance weight, then score; tagged uncertain on a narrow margin. */
    HIERARCHICAL,
    /** Higher confidence wins, then score. */
    CONFIDENCE,
    /** Newer timestamp wins, then score. */
    RECENCY,
    /** No winner: every member is tagged uncertain and keeps its rank. */
    UNCERTAIN
}
