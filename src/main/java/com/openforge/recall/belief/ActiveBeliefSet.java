package com.openforge.recall.belief;

import java.util.Set;

/**
 * Immutable snapshot of what is currently believed relevant.
 *
 * Loaded once per query and read-only for the whole scoring pass; a newer
 * snapshot carries a higher {@code version}.
 */
public record ActiveBeliefSet(Set<String> tags, long version) {

    public ActiveBeliefSet {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static ActiveBeliefSet empty() {
        return new ActiveBeliefSet(Set.of(), 0L);
    }

    public static ActiveBeliefSet of(String... rawTags) {
        return new ActiveBeliefSet(BeliefTags.normalizeAll(java.util.List.of(rawTags)), 0L);
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }
}
