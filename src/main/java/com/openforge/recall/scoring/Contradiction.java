package com.openforge.recall.scoring;

import java.util.List;

/**
 * Two candidates making opposing claims about the same entity under a shared belief tag.
 *
 * @param contradictedId  the item that loses (older, or less confident on a tie)
 * @param favoredId       the item that stays unpenalized
 * @param entity          subject the two claims disagree on
 * @param sharedTags      overlapping belief tags, sorted
 */
public record Contradiction(
        String       contradictedId,
        String       favoredId,
        String       entity,
        List<String> sharedTags
) {
    public Contradiction {
        sharedTags = sharedTags == null ? List.of() : List.copyOf(sharedTags);
    }
}
