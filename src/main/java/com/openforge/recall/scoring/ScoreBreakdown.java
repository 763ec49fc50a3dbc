package com.openforge.recall.scoring;

/**
 * Per-candidate factor values of one scoring pass. Produced fresh per query, never persisted.
 *
 * @param similarity         cosine(candidate, query)
 * @param recency            exp(-decayLambda * ageDays)
 * @param credibility        clamped source trust
 * @param confidence         clamped stored confidence
 * @param beliefAlignment    smoothed Jaccard overlap with the active beliefs
 * @param usage              1 - exp(-0.1 * timesUsed)
 * @param novelty            1 - mean cosine against already-selected items
 * @param conflictPenalty    applied contradiction penalty, 0 when none
 * @param arbitrationFactor  provenance multiplier from arbitration, 1.0 when disabled
 * @param finalScore         composite score after arbitration
 */
public record ScoreBreakdown(
        double similarity,
        double recency,
        double credibility,
        double confidence,
        double beliefAlignment,
        double usage,
        double novelty,
        double conflictPenalty,
        double arbitrationFactor,
        double finalScore
) {

    public static ScoreBreakdown zero() {
        return new ScoreBreakdown(0, 0, 0, 0, 0, 0, 0, 0, 1.0, 0);
    }

    /** Composite score before the arbitration factor. */
    public double compositeScore() {
        return arbitrationFactor == 0 ? 0 : finalScore / arbitrationFactor;
    }

    public ScoreBreakdown withArbitrationFactor(double factor) {
        double composite = compositeScore();
        return new ScoreBreakdown(similarity, recency, credibility, confidence, beliefAlignment,
                usage, novelty, conflictPenalty, factor, composite * factor);
    }
}
