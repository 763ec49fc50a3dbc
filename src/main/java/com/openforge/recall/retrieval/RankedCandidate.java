package com.openforge.recall.retrieval;

import com.openforge.recall.candidate.ProvenanceClass;
import com.openforge.recall.scoring.ScoreBreakdown;

import java.util.Set;

/**
 * One retrieval result.
 *
 * @param flags arbitration flags ("uncertain", "superseded"); empty for most results
 */
public record RankedCandidate(
        String          id,
        String          text,
        double          finalScore,
        ScoreBreakdown  breakdown,
        ProvenanceClass provenance,
        Set<String>     flags
) {
    public RankedCandidate {
        flags = flags == null ? Set.of() : Set.copyOf(flags);
    }
}
