package com.openforge.recall.candidate;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Set;

/**
 * One retrieved item under consideration for a single query.
 *
 * Instances are produced only by {@link CandidateNormalizer}, which fills
 * defaults and clamps numeric fields, so scoring code never deals with
 * missing or malformed values.
 *
 * @param id                 opaque store identifier
 * @param embedding          stored vector; null when the store did not return one
 * @param rawSimilarity      similarity reported by the store, clamped to [0,1]
 * @param text               content used for keyword matching and previews
 * @param tags               topic / source labels
 * @param timestamp          creation or last-relevance time; null means "now"
 * @param sourceTrust        0.0 – 1.0, default 0.6
 * @param confidence         0.0 – 1.0, default 0.5
 * @param importance         0.0 – 1.0, default 0.5
 * @param beliefTags         normalized tags used for belief alignment
 * @param timesUsed          non-negative usage counter
 * @param contradictionFlag  payload says this item conflicts with a held item
 * @param conflictScore      optional payload conflict strength
 * @param provenance         provenance class for arbitration
 * @param assertionKey       key shared by items asserting the same thing; may be null
 */
@Builder(toBuilder = true)
public record Candidate(
        String          id,
        @Nullable float[] embedding,
        double          rawSimilarity,
        String          text,
        Set<String>     tags,
        @Nullable Instant timestamp,
        double          sourceTrust,
        double          confidence,
        double          importance,
        Set<String>     beliefTags,
        int             timesUsed,
        boolean         contradictionFlag,
        @Nullable Double conflictScore,
        ProvenanceClass provenance,
        @Nullable String assertionKey
) {

    public static final double DEFAULT_SOURCE_TRUST = 0.6;
    public static final double DEFAULT_CONFIDENCE   = 0.5;
    public static final double DEFAULT_IMPORTANCE   = 0.5;

    public Candidate {
        id         = id == null ? "" : id;
        text       = text == null ? "" : text;
        tags       = tags == null ? Set.of() : Set.copyOf(tags);
        beliefTags = beliefTags == null ? Set.of() : Set.copyOf(beliefTags);
        provenance = provenance == null ? ProvenanceClass.BASE : provenance;
        timesUsed  = Math.max(0, timesUsed);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    /** True when the payload itself marks this item as conflicting. */
    public boolean flaggedByPayload() {
        return contradictionFlag || (conflictScore != null && conflictScore > 0);
    }
}
