package com.openforge.recall.retrieval;

import com.openforge.recall.arbitration.QueryIntent;
import com.openforge.recall.candidate.ProvenanceClass;
import com.openforge.recall.selection.SelectionStage;
import com.openforge.recall.store.FetchOutcome;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Why a retrieval came out the way it did.
 *
 * @param fetchOutcome      what the store layer reported
 * @param status            coarse quality of the result list
 * @param reason            why the list is empty; null when it is not
 * @param selectionStages   selection stages that fired (MMR included when applied after scoring)
 * @param thresholdUsed     similarity threshold that produced the selection
 * @param intent            classified query intent
 * @param effectiveWeights  provenance weights used for this query
 * @param rawHitCount       candidates the store returned
 * @param durationMs        wall time of the whole query
 */
public record RetrievalDiagnostics(
        FetchOutcome                  fetchOutcome,
        RetrievalStatus               status,
        @Nullable Reason              reason,
        Set<SelectionStage>           selectionStages,
        double                        thresholdUsed,
        QueryIntent                   intent,
        Map<ProvenanceClass, Double>  effectiveWeights,
        int                           rawHitCount,
        long                          durationMs
) {

    public enum Reason {
        EMBEDDING_FAILED,
        CIRCUIT_OPEN,
        STORE_TIMEOUT,
        STORE_ERROR,
        CANCELLED,
        NO_CANDIDATES,
        BELOW_THRESHOLD;

        /** Lower-case code for logs and payloads, e.g. {@code circuit_open}. */
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        static Reason of(FetchOutcome outcome) {
            return switch (outcome) {
                case CIRCUIT_OPEN -> CIRCUIT_OPEN;
                case TIMEOUT      -> STORE_TIMEOUT;
                case STORE_ERROR  -> STORE_ERROR;
                case CANCELLED    -> CANCELLED;
                default           -> NO_CANDIDATES;
            };
        }
    }

    public RetrievalDiagnostics {
        selectionStages  = selectionStages == null || selectionStages.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(selectionStages));
        effectiveWeights = effectiveWeights == null || effectiveWeights.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(effectiveWeights));
    }
}
