package com.openforge.recall.retrieval;

import java.util.List;

/**
 * Ranked results of one query plus the diagnostics explaining them. The list
 * may be empty; {@link RetrievalDiagnostics#reason()} then says why.
 */
public record RetrievalResult(List<RankedCandidate> results, RetrievalDiagnostics diagnostics) {

    public RetrievalResult {
        results = List.copyOf(results);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
