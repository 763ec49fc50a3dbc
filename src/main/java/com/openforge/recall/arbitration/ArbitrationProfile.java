package com.openforge.recall.arbitration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openforge.recall.candidate.ProvenanceClass;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Learned weight per provenance class. Serialized as the sidecar
 * {@code {"base":..,"episodic":..,"procedural":..,"abstraction":..}}.
 *
 * Instances are immutable and replaced as a whole, so a reader always sees
 * one consistent vector.
 */
public record ArbitrationProfile(
        double base,
        double episodic,
        double procedural,
        double abstraction
) {

    public static ArbitrationProfile uniform() {
        return new ArbitrationProfile(0.25, 0.25, 0.25, 0.25);
    }

    public static ArbitrationProfile of(Map<ProvenanceClass, Double> weights) {
        return new ArbitrationProfile(
                weights.getOrDefault(ProvenanceClass.BASE, 0.0),
                weights.getOrDefault(ProvenanceClass.EPISODIC, 0.0),
                weights.getOrDefault(ProvenanceClass.PROCEDURAL, 0.0),
                weights.getOrDefault(ProvenanceClass.ABSTRACTION, 0.0));
    }

    static ArbitrationProfile of(double[] v) {
        return new ArbitrationProfile(v[0], v[1], v[2], v[3]);
    }

    public double get(ProvenanceClass c) {
        return switch (c) {
            case BASE        -> base;
            case EPISODIC    -> episodic;
            case PROCEDURAL  -> procedural;
            case ABSTRACTION -> abstraction;
        };
    }

    @JsonIgnore
    public Map<ProvenanceClass, Double> asMap() {
        Map<ProvenanceClass, Double> m = new EnumMap<>(ProvenanceClass.class);
        for (ProvenanceClass c : ProvenanceClass.values()) {
            m.put(c, get(c));
        }
        return m;
    }

    double[] toArray() {
        return new double[]{base, episodic, procedural, abstraction};
    }

    @JsonIgnore
    public double sum() {
        return base + episodic + procedural + abstraction;
    }

    /**
     * Non-finite or negative entries are treated as 0, then every entry is
     * raised to at least {@code floor} and the vector is scaled to sum to 1.
     * An all-zero vector becomes uniform.
     */
    public ArbitrationProfile sanitized(double floor) {
        double[] v = toArray();
        for (int i = 0; i < v.length; i++) {
            if (!Double.isFinite(v[i]) || v[i] < 0) v[i] = 0.0;
        }
        return of(normalizeWithFloor(v, floor));
    }

    /**
     * Scales {@code v} to sum 1 while keeping each entry at or above {@code floor}:
     * entries that would fall below are pinned to the floor and the rest share
     * what remains in proportion.
     */
    static double[] normalizeWithFloor(double[] v, double floor) {
        int n = v.length;
        double f = Math.max(0.0, Math.min(floor, 1.0 / n));
        double total = 0.0;
        for (double x : v) total += x;
        if (total <= 0) {
            double[] out = new double[n];
            Arrays.fill(out, 1.0 / n);
            return out;
        }

        boolean[] pinned = new boolean[n];
        double[]  out    = new double[n];
        while (true) {
            double free = 1.0, mass = 0.0;
            for (int i = 0; i < n; i++) {
                if (pinned[i]) free -= f;
                else mass += v[i];
            }
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                if (pinned[i]) {
                    out[i] = f;
                    continue;
                }
                out[i] = mass > 0 ? v[i] / mass * free : free / countFree(pinned);
                if (out[i] < f) {
                    pinned[i] = true;
                    changed = true;
                }
            }
            if (!changed) return out;
        }
    }

    private static int countFree(boolean[] pinned) {
        int k = 0;
        for (boolean p : pinned) if (!p) k++;
        return Math.max(1, k);
    }
}
