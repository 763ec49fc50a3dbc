package com.openforge.recall.retrieval;

import com.openforge.recall.config.ConfigWarnings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Query facade settings.
 *
 * application.yml:
 *
 * recall:
 *   retrieval:
 *     default-top-k: 5
 *     fetch-multiplier: 3      # store is asked for topK * fetch-multiplier candidates
 *     max-fetch: 200
 */
@ConfigurationProperties(prefix = "recall.retrieval")
public record RetrievalProperties(
        @DefaultValue("5")   int defaultTopK,
        @DefaultValue("3")   int fetchMultiplier,
        @DefaultValue("200") int maxFetch
) {
    public RetrievalProperties {
        defaultTopK     = ConfigWarnings.atLeast("recall.retrieval.default-top-k", defaultTopK, 1, 5);
        fetchMultiplier = ConfigWarnings.atLeast("recall.retrieval.fetch-multiplier", fetchMultiplier, 1, 3);
        maxFetch        = ConfigWarnings.atLeast("recall.retrieval.max-fetch", maxFetch, 1, 200);
    }

    public static RetrievalProperties defaults() {
        return new RetrievalProperties(5, 3, 200);
    }

    /** Candidates to request from the store for a query wanting {@code topK} results. */
    public int fetchSize(int topK) {
        long wanted = (long) Math.max(1, topK) * fetchMultiplier;
        return (int) Math.max(topK, Math.min(maxFetch, wanted));
    }
}
