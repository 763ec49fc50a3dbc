package com.openforge.recall.arbitration;

import com.openforge.recall.scoring.ScoredCandidate;

import java.util.Set;

/**
 * A scored candidate after conflict resolution.
 *
 * @param scored  the candidate and its score breakdown
 * @param flags   {@link #UNCERTAIN} and / or {@link #SUPERSEDED}; empty when untouched
 */
public record ArbitratedCandidate(ScoredCandidate scored, Set<String> flags) {

    public static final String UNCERTAIN  = "uncertain";
    public static final String SUPERSEDED = "superseded";

    public ArbitratedCandidate {
        flags = flags == null ? Set.of() : Set.copyOf(flags);
    }

    public static ArbitratedCandidate plain(ScoredCandidate scored) {
        return new ArbitratedCandidate(scored, Set.of());
    }
}
