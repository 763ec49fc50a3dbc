package com.openforge.recall.selection;

import com.openforge.recall.candidate.Vectors;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Maximal Marginal Relevance.
 *
 * The most relevant item goes first; each further pick maximizes
 * {@code lambda * relevance(i) - (1 - lambda) * max cosine(i, selected)}.
 * lambda near 1.0 favors relevance, near 0.0 favors diversity.
 * Ties keep input order.
 */
@Component
public class MmrReranker {

    /**
     * @return at most {@code min(k, items.size())} items. When no item carries an
     *         embedding the input order is kept and truncated; otherwise items
     *         without an embedding are left out.
     */
    public <T> List<T> rerank(List<T> items,
                              int k,
                              double lambda,
                              ToDoubleFunction<T> relevance,
                              Function<T, float[]> embedding) {
        if (items == null || items.isEmpty() || k <= 0) return List.of();

        List<T> pool = new ArrayList<>(items.size());
        for (T item : items) {
            float[] e = embedding.apply(item);
            if (e != null && e.length > 0) pool.add(item);
        }
        if (pool.isEmpty()) {
            return List.copyOf(items.subList(0, Math.min(k, items.size())));
        }

        double lam   = Math.max(0.0, Math.min(1.0, lambda));
        int    limit = Math.min(k, pool.size());

        List<T> selected  = new ArrayList<>(limit);
        List<T> remaining = new ArrayList<>(pool);

        T first = remaining.get(0);
        for (T candidate : remaining) {
            if (relevance.applyAsDouble(candidate) > relevance.applyAsDouble(first)) first = candidate;
        }
        selected.add(first);
        remaining.remove(first);

        while (selected.size() < limit) {
            T      best      = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (T candidate : remaining) {
                double redundancy = 0.0;
                float[] ce = embedding.apply(candidate);
                for (T chosen : selected) {
                    redundancy = Math.max(redundancy, Vectors.cosine(ce, embedding.apply(chosen)));
                }
                double score = lam * relevance.applyAsDouble(candidate) - (1.0 - lam) * redundancy;
                if (score > bestScore) {
                    bestScore = score;
                    best      = candidate;
                }
            }
            selected.add(best);
            remaining.remove(best);
        }
        return selected;
    }
}
