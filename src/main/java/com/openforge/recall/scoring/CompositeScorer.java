package com.openforge.recall.scoring;

import com.openforge.recall.candidate.Candidate;
import com.openforge.recall.candidate.Vectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import java.util.stream.Stream;

/**
 * Composite scoring engine.
 *
 * Each factor is computed independently, then combined as
 *
 *   final = w_sim * similarity
 *         * (1 + w_rec  * recency)
 *         * (1 + w_cred * (credibility - 0.5))
 *         * (1 + w_conf * (confidence  - 0.5))
 *         * (1 + w_bel  * (beliefAlignment - 0.5))
 *         * (1 + w_use  * usage)
 *         * (1 + w_nov  * novelty)
 *         * (1 - conflictPenalty)
 *
 * {@link #score} is pure: identical inputs always give identical output.
 */
@Slf4j
@Component
public class CompositeScorer {

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double USAGE_RATE      = 0.1;

    private final int parallelThreshold;

    @Autowired
    public CompositeScorer(ScoringProperties props) {
        this(props.parallelThreshold());
    }

    /** @param parallelThreshold pool size from which a ranking round scores in parallel; 0 disables */
    public CompositeScorer(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }

    // ── Single candidate ─────────────────────────────────────────────────────

    public ScoredCandidate score(Candidate c,
                                 @Nullable float[] queryVector,
                                 List<Candidate> alreadySelected,
                                 ScoringWeights w,
                                 ScoringContext ctx) {
        if (!c.hasEmbedding()) {
            return new ScoredCandidate(c, ScoreBreakdown.zero());
        }

        double similarity  = Vectors.cosine(c.embedding(), queryVector);
        double recency     = recency(c.timestamp(), ctx.now(), w.decayLambda());
        double credibility = Vectors.clamp01(c.sourceTrust());
        double confidence  = Vectors.clamp01(c.confidence());
        double alignment   = beliefAlignment(c.beliefTags(), ctx.beliefs().tags(),
                w.beliefAlpha(), w.beliefImportanceBoost(), ctx.importantNamespaces());
        double usage       = 1.0 - Math.exp(-USAGE_RATE * c.timesUsed());
        double novelty     = novelty(c, alreadySelected);
        double penalty     = w.contradictionsEnabled()
                && (c.flaggedByPayload() || ctx.contradictedIds().contains(c.id()))
                ? w.conflictPenalty()
                : 0.0;

        double base = w.wSim() * similarity;
        double multiplier = (1 + w.wRec() * recency)
                * (1 + w.wCred() * (credibility - 0.5))
                * (1 + w.wConf() * (confidence - 0.5))
                * (1 + w.wBel() * (alignment - 0.5))
                * (1 + w.wUse() * usage)
                * (1 + w.wNov() * novelty);
        multiplier *= (1 - penalty);

        return new ScoredCandidate(c, new ScoreBreakdown(
                similarity, recency, credibility, confidence, alignment,
                usage, novelty, penalty, 1.0, base * multiplier));
    }

    // ── Greedy ranking ───────────────────────────────────────────────────────

    /**
     * Picks up to {@code limit} candidates one at a time. Every round rescores the
     * remaining pool against what has been picked so far, so novelty reflects the
     * actual selection. {@code classFactor} scales each composite score (arbitration);
     * pass {@code c -> 1.0} for none.
     */
    public List<ScoredCandidate> rankGreedy(List<Candidate> pool,
                                            @Nullable float[] queryVector,
                                            int limit,
                                            ScoringWeights w,
                                            ScoringContext ctx,
                                            ToDoubleFunction<Candidate> classFactor) {
        List<Candidate>       remaining = new ArrayList<>(pool);
        List<Candidate>       picked    = new ArrayList<>();
        List<ScoredCandidate> ranked    = new ArrayList<>();
        int n = Math.min(Math.max(0, limit), pool.size());

        while (ranked.size() < n) {
            List<Candidate> selectedSoFar = List.copyOf(picked);
            Stream<Candidate> stream = parallelThreshold > 0 && remaining.size() >= parallelThreshold
                    ? remaining.parallelStream()
                    : remaining.stream();
            List<ScoredCandidate> round = stream
                    .map(c -> {
                        ScoredCandidate sc = score(c, queryVector, selectedSoFar, w, ctx);
                        double factor = classFactor.applyAsDouble(c);
                        return factor == 1.0 ? sc
                                : new ScoredCandidate(c, sc.breakdown().withArbitrationFactor(factor));
                    })
                    .toList();

            ScoredCandidate best = round.get(0);
            for (int i = 1; i < round.size(); i++) {
                if (ranksBefore(round.get(i), best)) best = round.get(i);
            }
            ranked.add(best);
            picked.add(best.candidate());
            remaining.remove(best.candidate());
        }
        log.debug("[Score] Ranked {} of {} candidates", ranked.size(), pool.size());
        return ranked;
    }

    /** Score desc, then raw similarity desc, then id asc. */
    static boolean ranksBefore(ScoredCandidate a, ScoredCandidate b) {
        int cmp = Double.compare(a.finalScore(), b.finalScore());
        if (cmp != 0) return cmp > 0;
        cmp = Double.compare(a.candidate().rawSimilarity(), b.candidate().rawSimilarity());
        if (cmp != 0) return cmp > 0;
        return a.id().compareTo(b.id()) < 0;
    }

    // ── Factors ──────────────────────────────────────────────────────────────

    static double recency(@Nullable Instant timestamp, Instant now, double decayLambda) {
        if (timestamp == null) return 1.0;
        double ageDays = Math.max(0.0, Duration.between(timestamp, now).toMillis() / 1000.0 / SECONDS_PER_DAY);
        return Math.exp(-decayLambda * ageDays);
    }

    /**
     * Smoothed Jaccard {@code (|A∩B| + alpha) / (|A∪B| + alpha)}, plus {@code boost}
     * (capped at 1) when any shared tag starts with an important namespace.
     * Two empty sets give {@code alpha / 1}.
     */
    static double beliefAlignment(Set<String> candidateTags,
                                  Set<String> activeTags,
                                  double alpha,
                                  double boost,
                                  List<String> importantNamespaces) {
        int intersection = 0;
        boolean important = false;
        for (String tag : candidateTags) {
            if (activeTags.contains(tag)) {
                intersection++;
                if (!important && inNamespace(tag, importantNamespaces)) important = true;
            }
        }
        int union = candidateTags.size() + activeTags.size() - intersection;
        if (union == 0) return Vectors.clamp01(alpha / 1.0);
        double alignment = (intersection + alpha) / (union + alpha);
        if (important && boost > 0) {
            alignment = Math.min(1.0, alignment + boost);
        }
        return Vectors.clamp01(alignment);
    }

    private static boolean inNamespace(String tag, List<String> namespaces) {
        for (String ns : namespaces) {
            if (!ns.isEmpty() && tag.startsWith(ns)) return true;
        }
        return false;
    }

    private static double novelty(Candidate c, List<Candidate> alreadySelected) {
        if (alreadySelected.isEmpty()) return 0.0;
        List<float[]> others = new ArrayList<>(alreadySelected.size());
        for (Candidate s : alreadySelected) {
            if (s.hasEmbedding()) others.add(s.embedding());
        }
        if (others.isEmpty()) return 0.0;
        return Math.max(0.0, 1.0 - Vectors.meanCosine(c.embedding(), others));
    }
}
