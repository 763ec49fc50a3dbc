package com.openforge.recall.selection;

import com.openforge.recall.candidate.Candidate;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of {@link CandidateSelector#select}.
 *
 * @param selected          kept candidates, in ranking order
 * @param rankingSimilarity similarity used for ordering per id (keyword-boosted where applied)
 * @param thresholdUsed     threshold that produced the selection
 * @param stages            stages that fired, in pipeline order
 * @param reason            why the selection is empty; null when it is not
 */
public record SelectionResult(
        List<Candidate>      selected,
        Map<String, Double>  rankingSimilarity,
        double               thresholdUsed,
        Set<SelectionStage>  stages,
        @Nullable Reason     reason
) {

    public enum Reason {
        NO_CANDIDATES,
        BELOW_THRESHOLD
    }

    public SelectionResult {
        selected          = List.copyOf(selected);
        rankingSimilarity = Map.copyOf(rankingSimilarity);
        stages            = stages.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(stages));
    }

    public boolean isEmpty() {
        return selected.isEmpty();
    }

    /** Boosted similarity when a keyword boost applied, else the raw store similarity. */
    public double similarityOf(Candidate c) {
        return rankingSimilarity.getOrDefault(c.id(), c.rawSimilarity());
    }
}
