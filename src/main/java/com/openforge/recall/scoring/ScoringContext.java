package com.openforge.recall.scoring;

import com.openforge.recall.belief.ActiveBeliefSet;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Read-only inputs shared by every candidate of one query.
 *
 * @param beliefs              active belief snapshot taken at query start
 * @param contradictedIds      ids flagged by the contradiction detector for this candidate set
 * @param importantNamespaces  belief tag prefixes that earn the importance boost
 * @param now                  reference time for recency, fixed for the whole query
 */
public record ScoringContext(
        ActiveBeliefSet beliefs,
        Set<String>     contradictedIds,
        List<String>    importantNamespaces,
        Instant         now
) {
    public ScoringContext {
        beliefs             = beliefs == null ? ActiveBeliefSet.empty() : beliefs;
        contradictedIds     = contradictedIds == null ? Set.of() : Set.copyOf(contradictedIds);
        importantNamespaces = importantNamespaces == null ? List.of() : List.copyOf(importantNamespaces);
        now                 = now == null ? Instant.now() : now;
    }

    public static ScoringContext at(Instant now) {
        return new ScoringContext(ActiveBeliefSet.empty(), Set.of(), List.of(), now);
    }

    public ScoringContext withContradictedIds(Set<String> ids) {
        return new ScoringContext(beliefs, ids, importantNamespaces, now);
    }
}
