package com.openforge.recall.store;

import com.openforge.recall.candidate.Candidate;

import java.util.List;

/**
 * Result of one logical fetch. {@code candidates} is empty for every outcome
 * other than {@link FetchOutcome#OK}.
 *
 * @param candidates normalized hits in store order
 * @param outcome    why the fetch ended the way it did
 * @param attempts   physical store calls made (0 when the breaker rejected)
 */
public record StoreFetch(List<Candidate> candidates, FetchOutcome outcome, int attempts) {

    public StoreFetch {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static StoreFetch failed(FetchOutcome outcome, int attempts) {
        return new StoreFetch(List.of(), outcome, attempts);
    }
}
