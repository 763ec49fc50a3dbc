package com.openforge.recall.arbitration;

/** Downstream verdicts on a surfaced candidate, fed back into the learning loop. */
public enum FeedbackKind {
    /** Kept by the downstream judge. */
    KEPT,
    /** Dropped by the downstream judge. */
    DROPPED,
    /** Kept, but flagged as uncertain. */
    UNCERTAIN,
    /** Involved in a contradiction; the event value is its severity (0–1). */
    CONTRADICTED,
    /** Usefulness rating; the event value is the rating (0–1). */
    USEFUL,
    /** The memory was reinforced (used again, confirmed). */
    REINFORCED,
    /** The memory decayed (ignored, aged out). */
    DECAYED
}
