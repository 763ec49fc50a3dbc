package com.openforge.recall.candidate;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Vector math shared by scoring, selection and MMR.
 */
public final class Vectors {

    private Vectors() {}

    /**
     * Cosine similarity; 0 when either vector is null, empty or zero-norm.
     *
     * @throws VectorDimensionMismatchException when lengths differ
     */
    public static double cosine(@Nullable float[] a, @Nullable float[] b) {
        if (a == null || b == null || a.length == 0 || b.length == 0) return 0.0;
        if (a.length != b.length) {
            throw new VectorDimensionMismatchException(a.length, b.length);
        }
        double dot = 0.0, normA = 0.0, normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            double ai = a[i];
            double bi = b[i];
            dot   += ai * bi;
            normA += ai * ai;
            normB += bi * bi;
        }
        if (normA <= 0 || normB <= 0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /** Mean cosine of {@code vector} against every non-null vector in {@code others}; 0 if none. */
    public static double meanCosine(@Nullable float[] vector, List<float[]> others) {
        if (vector == null || others.isEmpty()) return 0.0;
        double sum = 0.0;
        int    n   = 0;
        for (float[] o : others) {
            if (o == null || o.length == 0) continue;
            sum += cosine(vector, o);
            n++;
        }
        return n == 0 ? 0.0 : sum / n;
    }

    /**
     * Copies {@code values} into a {@code float[]}. Returns null when the list is empty
     * or any component is missing, non-numeric, NaN or infinite; such a vector is unusable.
     */
    @Nullable
    public static float[] toArray(@Nullable List<?> values) {
        if (values == null || values.isEmpty()) return null;
        float[] out = new float[values.size()];
        for (int i = 0; i < out.length; i++) {
            if (!(values.get(i) instanceof Number n)) return null;
            float f = n.floatValue();
            if (!Float.isFinite(f)) return null;
            out[i] = f;
        }
        return out;
    }

    public static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.min(1.0, Math.max(0.0, v));
    }
}
