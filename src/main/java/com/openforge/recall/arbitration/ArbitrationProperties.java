package com.openforge.recall.arbitration;

import com.openforge.recall.candidate.ProvenanceClass;
import com.openforge.recall.config.ConfigWarnings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Arbitration layer configuration.
 *
 * application.yml:
 *
 * recall:
 *   arbitration:
 *     enabled: true
 *     mode: context
 *     base-weights:   { base: 0.25, episodic: 0.25, procedural: 0.25, abstraction: 0.25 }
 *     intent-multipliers:
 *       how: { base: 0.8, episodic: 1.0, procedural: 1.5, abstraction: 0.9 }
 *     conflict-policy: hierarchical
 *     conflict-epsilon: 0.10
 *     uncertain-threshold: 0.05
 *     learning:
 *       enabled: false
 *       observe-only: true
 *       interval-ms: 300000
 *       profile-path: data/arbitration-profile.json
 *
 * Missing table entries fall back to the built-in values, per class.
 */
@ConfigurationProperties(prefix = "recall.arbitration")
public record ArbitrationProperties(
        @DefaultValue("false")        boolean enabled,
        @DefaultValue("context")      Mode mode,
        Map<String, Double>           baseWeights,
        Map<String, Map<String, Double>> intentMultipliers,
        @DefaultValue("hierarchical") ConflictPolicy conflictPolicy,
        @DefaultValue("0.10")         double conflictEpsilon,
        @DefaultValue("0.05")         double uncertainThreshold,
        @DefaultValue                 Learning learning
) {

    public enum Mode {
        /** Base weights times the per-intent multipliers. */
        CONTEXT,
        /** Base weights only; intent is ignored. */
        STATIC
    }

    private static final Map<QueryIntent, Map<ProvenanceClass, Double>> DEFAULT_MULTIPLIERS = Map.of(
            QueryIntent.HOW,  Map.of(ProvenanceClass.BASE, 0.8, ProvenanceClass.EPISODIC, 1.0,
                                     ProvenanceClass.PROCEDURAL, 1.5, ProvenanceClass.ABSTRACTION, 0.9),
            QueryIntent.WHY,  Map.of(ProvenanceClass.BASE, 0.8, ProvenanceClass.EPISODIC, 1.0,
                                     ProvenanceClass.PROCEDURAL, 0.9, ProvenanceClass.ABSTRACTION, 1.5),
            QueryIntent.FACT, Map.of(ProvenanceClass.BASE, 1.3, ProvenanceClass.EPISODIC, 1.3,
                                     ProvenanceClass.PROCEDURAL, 0.9, ProvenanceClass.ABSTRACTION, 0.9));

    public ArbitrationProperties {
        mode               = mode == null ? Mode.CONTEXT : mode;
        baseWeights        = baseWeights == null ? Map.of() : Map.copyOf(baseWeights);
        intentMultipliers  = intentMultipliers == null ? Map.of() : Map.copyOf(intentMultipliers);
        conflictPolicy     = conflictPolicy == null ? ConflictPolicy.HIERARCHICAL : conflictPolicy;
        conflictEpsilon    = ConfigWarnings.inRange("recall.arbitration.conflict-epsilon", conflictEpsilon, 0.0, 1.0, 0.10);
        uncertainThreshold = ConfigWarnings.inRange("recall.arbitration.uncertain-threshold",
                uncertainThreshold, 0.0, 1.0, 0.05);
        learning           = learning == null ? Learning.defaults() : learning;
    }

    public static ArbitrationProperties defaults(boolean enabled) {
        return new ArbitrationProperties(enabled, Mode.CONTEXT, Map.of(), Map.of(),
                ConflictPolicy.HIERARCHICAL, 0.10, 0.05, Learning.defaults());
    }

    public double baseWeight(ProvenanceClass c) {
        Double v = baseWeights.get(c.key());
        return v == null ? 0.25 : ConfigWarnings.nonNegative("recall.arbitration.base-weights." + c.key(), v, 0.25);
    }

    public double multiplier(QueryIntent intent, ProvenanceClass c) {
        Map<String, Double> row = intentMultipliers.get(intent.key());
        Double v = row == null ? null : row.get(c.key());
        double dflt = DEFAULT_MULTIPLIERS.get(intent).get(c);
        return v == null ? dflt
                : ConfigWarnings.nonNegative("recall.arbitration.intent-multipliers." + intent.key() + "." + c.key(), v, dflt);
    }

    /**
     * Learning loop settings.
     *
     * @param enabled       run the learning cycle and let the learned profile shape weights
     * @param observeOnly   compute and log proposals without applying or persisting them
     * @param intervalMs    delay between cycles
     * @param window        feedback events kept in the trailing window
     * @param minEvents     fewer events than this and the cycle is skipped
     * @param maxShift      largest per-class change one cycle may make
     * @param damping       fraction of the clamped delta actually applied
     * @param floor         lowest weight any class may reach
     * @param profilePath   JSON sidecar; blank keeps the profile in memory only
     */
    public record Learning(
            @DefaultValue("false")  boolean enabled,
            @DefaultValue("true")   boolean observeOnly,
            @DefaultValue("300000") long    intervalMs,
            @DefaultValue("500")    int     window,
            @DefaultValue("20")     int     minEvents,
            @DefaultValue("0.10")   double  maxShift,
            @DefaultValue("0.20")   double  damping,
            @DefaultValue("0.05")   double  floor,
            String profilePath
    ) {
        public Learning {
            window    = ConfigWarnings.atLeast("recall.arbitration.learning.window", window, 1, 500);
            minEvents = ConfigWarnings.atLeast("recall.arbitration.learning.min-events", minEvents, 0, 20);
            maxShift  = ConfigWarnings.inRange("recall.arbitration.learning.max-shift", maxShift, 0.0, 1.0, 0.10);
            damping   = ConfigWarnings.inRange("recall.arbitration.learning.damping", damping, 0.0, 1.0, 0.20);
            floor     = ConfigWarnings.inRange("recall.arbitration.learning.floor", floor, 0.0, 0.25, 0.05);
        }

        public static Learning defaults() {
            return new Learning(false, true, 300_000L, 500, 20, 0.10, 0.20, 0.05, null);
        }
    }
}
