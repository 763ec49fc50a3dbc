package com.openforge.recall.selection;

/** Pipeline stages, reported in diagnostics when they changed the outcome. */
public enum SelectionStage {
    THRESHOLD,
    DYNAMIC_THRESHOLD,
    KEYWORD_BOOST,
    DEDUPE,
    MMR,
    TOP1_FALLBACK,
    MIN_RESULTS
}
