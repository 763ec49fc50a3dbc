package com.openforge.recall.scoring;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Composite scoring configuration.
 *
 * Weight profiles are kept as raw text so that a typo in one value degrades
 * that single value to its default instead of failing startup.
 *
 * application.yml:
 *
 * recall:
 *   scoring:
 *     profile: default
 *     contradictions-enabled: true
 *     parallel-threshold: 64
 *     profiles:
 *       default: {}
 *       recency-heavy:
 *         w_rec: "1.2"
 *         decay_lambda: "0.05"
 */
@ConfigurationProperties(prefix = "recall.scoring")
public record ScoringProperties(
        @DefaultValue("default") String profile,
        Map<String, Map<String, String>> profiles,
        @DefaultValue("true") boolean contradictionsEnabled,
        @DefaultValue("64") int parallelThreshold
) {
    public ScoringProperties {
        profiles = profiles == null ? Map.of() : Map.copyOf(profiles);
    }

    public static ScoringProperties defaults() {
        return new ScoringProperties("default", Map.of(), true, 64);
    }
}
