package com.openforge.recall.scoring;

import com.openforge.recall.config.ConfigWarnings;
import lombok.Builder;

/**
 * Weights and constants of the composite score.
 *
 * All {@code w*} weights are non-negative; a negative or non-finite value
 * is replaced by its default (with a one-time warning) rather than rejected.
 *
 * @param wSim                   weight of cosine similarity (the base term)
 * @param wRec                   weight of recency
 * @param wCred                  weight of source credibility
 * @param wConf                  weight of stored confidence
 * @param wBel                   weight of belief alignment
 * @param wUse                   weight of usage
 * @param wNov                   weight of novelty against already-selected items
 * @param decayLambda            recency decay per day
 * @param beliefAlpha            Jaccard smoothing constant
 * @param beliefImportanceBoost  added to alignment when an overlapping tag is in an important namespace
 * @param conflictPenalty        multiplier reduction for contradicted items, 0.0 – 1.0
 * @param contradictionsEnabled  whether the conflict penalty applies at all
 */
@Builder(toBuilder = true)
public record ScoringWeights(
        double  wSim,
        double  wRec,
        double  wCred,
        double  wConf,
        double  wBel,
        double  wUse,
        double  wNov,
        double  decayLambda,
        double  beliefAlpha,
        double  beliefImportanceBoost,
        double  conflictPenalty,
        boolean contradictionsEnabled
) {

    public static final ScoringWeights DEFAULTS = new ScoringWeights(
            1.0, 0.6, 0.5, 0.3, 0.4, 0.2, 0.1,
            0.015, 0.1, 0.1, 0.05, true);

    public ScoringWeights {
        wSim                  = ConfigWarnings.nonNegative("w_sim", wSim, 1.0);
        wRec                  = ConfigWarnings.nonNegative("w_rec", wRec, 0.6);
        wCred                 = ConfigWarnings.nonNegative("w_cred", wCred, 0.5);
        wConf                 = ConfigWarnings.nonNegative("w_conf", wConf, 0.3);
        wBel                  = ConfigWarnings.nonNegative("w_bel", wBel, 0.4);
        wUse                  = ConfigWarnings.nonNegative("w_use", wUse, 0.2);
        wNov                  = ConfigWarnings.nonNegative("w_nov", wNov, 0.1);
        decayLambda           = ConfigWarnings.nonNegative("decay_lambda", decayLambda, 0.015);
        beliefAlpha           = beliefAlpha > 0 && Double.isFinite(beliefAlpha)
                ? beliefAlpha
                : fallback("belief_alpha", beliefAlpha, 0.1);
        beliefImportanceBoost = ConfigWarnings.inRange("belief_importance_boost", beliefImportanceBoost, 0.0, 1.0, 0.1);
        conflictPenalty       = ConfigWarnings.inRange("conflict_penalty", conflictPenalty, 0.0, 1.0, 0.05);
    }

    private static double fallback(String key, double bad, double dflt) {
        ConfigWarnings.warnOnce(key, bad, dflt);
        return dflt;
    }
}
