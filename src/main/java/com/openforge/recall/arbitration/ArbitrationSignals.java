package com.openforge.recall.arbitration;

import com.openforge.recall.candidate.ProvenanceClass;

import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregated feedback over the trailing window, per provenance class.
 *
 * @param byClass      per-class aggregates; every class is present
 * @param totalEvents  events in the window across all classes
 */
public record ArbitrationSignals(Map<ProvenanceClass, ClassSignals> byClass, int totalEvents) {

    public ArbitrationSignals {
        Map<ProvenanceClass, ClassSignals> full = new EnumMap<>(ProvenanceClass.class);
        for (ProvenanceClass c : ProvenanceClass.values()) {
            ClassSignals s = byClass == null ? null : byClass.get(c);
            full.put(c, s == null ? ClassSignals.NEUTRAL : s);
        }
        byClass = Map.copyOf(full);
    }

    public ClassSignals of(ProvenanceClass c) {
        return byClass.get(c);
    }

    /**
     * @param events                 feedback events for the class
     * @param keptRate               kept / (kept + dropped), 0.5 without verdicts
     * @param uncertainRate          share of events flagged uncertain
     * @param contradictionSeverity  summed severity over events, 0 – 1
     * @param usefulness             mean usefulness rating, 0.5 without ratings
     * @param reinforcement          (reinforced - decayed) / (reinforced + decayed), -1 – 1
     */
    public record ClassSignals(
            int    events,
            double keptRate,
            double uncertainRate,
            double contradictionSeverity,
            double usefulness,
            double reinforcement
    ) {
        public static final ClassSignals NEUTRAL = new ClassSignals(0, 0.5, 0.0, 0.0, 0.5, 0.0);
    }
}
