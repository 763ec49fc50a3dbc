package com.openforge.recall.scoring;

import com.openforge.recall.candidate.Candidate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds candidates that conflict with another, currently-favored candidate
 * of the same result set. Flagged ids receive the conflict penalty.
 */
public interface ContradictionDetector {

    List<Contradiction> detect(List<Candidate> candidates);

    default Set<String> contradictedIds(List<Candidate> candidates) {
        Set<String> ids = new LinkedHashSet<>();
        for (Contradiction c : detect(candidates)) {
            ids.add(c.contradictedId());
        }
        return ids;
    }
}
