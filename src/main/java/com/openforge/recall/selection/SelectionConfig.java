package com.openforge.recall.selection;

import com.openforge.recall.config.ConfigWarnings;
import lombok.Builder;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Locale;

/**
 * Candidate selection knobs. Every optional stage is off by default, which
 * leaves a plain similarity-threshold filter.
 *
 * application.yml:
 *
 * recall:
 *   selection:
 *     threshold: 0.30
 *     dynamic-threshold-enabled: true
 *     floor-threshold: 0.15
 *     top1-fallback-enabled: false
 *     min-results: 0
 *     keyword-boost-enabled: true
 *     keyword-fields: content,tags
 *     dedupe-enabled: true
 *     dedupe-threshold: 0.85
 *     mmr-enabled: true
 *     mmr-lambda: 0.70
 *     mmr-k: 5
 */
@Builder(toBuilder = true)
@ConfigurationProperties(prefix = "recall.selection")
public record SelectionConfig(
        @DefaultValue("0.30")  double       threshold,
        @DefaultValue("false") boolean      dynamicThresholdEnabled,
        @DefaultValue("0.15")  double       floorThreshold,
        @DefaultValue("false") boolean      top1FallbackEnabled,
        @DefaultValue("0")     int          minResults,
        @DefaultValue("false") boolean      keywordBoostEnabled,
        @DefaultValue({"content", "tags"}) List<String> keywordFields,
        @DefaultValue("0.05")  double       keywordBoostUnit,
        @DefaultValue("false") boolean      dedupeEnabled,
        @DefaultValue("0.85")  double       dedupeThreshold,
        @DefaultValue("false") boolean      mmrEnabled,
        @DefaultValue("0.70")  double       mmrLambda,
        @DefaultValue("5")     int          mmrK,
        @DefaultValue("3")     int          statusMinCount,
        @DefaultValue("0.30")  double       statusMinSimilarity,
        @DefaultValue("false") boolean      logTelemetry,
        @DefaultValue("160")   int          previewChars
) {

    public SelectionConfig {
        threshold           = ConfigWarnings.inRange("recall.selection.threshold", threshold, 0.0, 1.0, 0.30);
        floorThreshold      = ConfigWarnings.inRange("recall.selection.floor-threshold", floorThreshold, 0.0, 1.0, 0.15);
        minResults          = ConfigWarnings.atLeast("recall.selection.min-results", minResults, 0, 0);
        keywordBoostUnit    = ConfigWarnings.nonNegative("recall.selection.keyword-boost-unit", keywordBoostUnit, 0.05);
        dedupeThreshold     = ConfigWarnings.inRange("recall.selection.dedupe-threshold", dedupeThreshold, 0.0, 1.0, 0.85);
        mmrLambda           = Double.isFinite(mmrLambda) ? Math.max(0.0, Math.min(1.0, mmrLambda)) : 0.70;
        mmrK                = Math.max(1, mmrK);
        statusMinCount      = ConfigWarnings.atLeast("recall.selection.status-min-count", statusMinCount, 0, 3);
        statusMinSimilarity = ConfigWarnings.inRange("recall.selection.status-min-similarity",
                statusMinSimilarity, 0.0, 1.0, 0.30);
        previewChars        = Math.max(24, previewChars);
        keywordFields       = normalizeFields(keywordFields);
    }

    /** Threshold 0.30 with every fallback, boost and rerank stage disabled. */
    public static SelectionConfig defaults() {
        return new SelectionConfig(0.30, false, 0.15, false, 0, false, List.of("content", "tags"),
                0.05, false, 0.85, false, 0.70, 5, 3, 0.30, false, 160);
    }

    /** Same configuration with the MMR stage turned off, for callers that rerank later. */
    public SelectionConfig withoutMmr() {
        return mmrEnabled ? toBuilder().mmrEnabled(false).build() : this;
    }

    private static List<String> normalizeFields(List<String> raw) {
        if (raw == null) return List.of("content", "tags");
        List<String> out = raw.stream()
                .filter(f -> f != null && !f.isBlank())
                .map(f -> f.strip().toLowerCase(Locale.ROOT))
                .toList();
        return out.isEmpty() ? List.of("content", "tags") : out;
    }
}
