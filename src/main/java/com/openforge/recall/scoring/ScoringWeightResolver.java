package com.openforge.recall.scoring;

import com.openforge.recall.config.ConfigWarnings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the named weight profiles of {@link ScoringProperties} into
 * sanitized {@link ScoringWeights}.
 *
 * Recognised profile keys: w_sim, w_rec, w_cred, w_conf, w_bel, w_use, w_nov,
 * decay_lambda, belief_alpha, belief_importance_boost, conflict_penalty.
 * Keys not present keep their defaults; separators in key names are ignored.
 */
@Slf4j
@Component
@EnableConfigurationProperties(ScoringProperties.class)
public class ScoringWeightResolver {

    private final ScoringProperties props;
    private final ScoringWeights    active;

    public ScoringWeightResolver(ScoringProperties props) {
        this.props  = props;
        this.active = resolve(props.profile());
        log.info("[Scoring] Active weight profile '{}': {}", props.profile(), active);
    }

    /** Weights of the configured active profile. */
    public ScoringWeights active() {
        return active;
    }

    public ScoringWeights resolve(String profileName) {
        Map<String, String> values = props.profiles().get(profileName);
        if (values == null) {
            if (!"default".equals(profileName)) {
                ConfigWarnings.warnOnce("recall.scoring.profile", profileName, "default");
            }
            values = Map.of();
        }
        return fromMap(values, props.contradictionsEnabled());
    }

    static ScoringWeights fromMap(Map<String, String> raw, boolean contradictionsEnabled) {
        Map<String, String> v = canonicalKeys(raw);
        ScoringWeights d = ScoringWeights.DEFAULTS;
        return ScoringWeights.builder()
                .wSim(parse(v, "w_sim", d.wSim()))
                .wRec(parse(v, "w_rec", d.wRec()))
                .wCred(parse(v, "w_cred", d.wCred()))
                .wConf(parse(v, "w_conf", d.wConf()))
                .wBel(parse(v, "w_bel", d.wBel()))
                .wUse(parse(v, "w_use", d.wUse()))
                .wNov(parse(v, "w_nov", d.wNov()))
                .decayLambda(parse(v, "decay_lambda", d.decayLambda()))
                .beliefAlpha(parse(v, "belief_alpha", d.beliefAlpha()))
                .beliefImportanceBoost(parse(v, "belief_importance_boost", d.beliefImportanceBoost()))
                .conflictPenalty(parse(v, "conflict_penalty", d.conflictPenalty()))
                .contradictionsEnabled(contradictionsEnabled)
                .build();
    }

    private static double parse(Map<String, String> canonical, String key, double dflt) {
        return ConfigWarnings.parse(key, canonical.get(canonical(key)), dflt);
    }

    // Map keys reach us as w_sim, w-sim or wsim depending on the property source
    private static Map<String, String> canonicalKeys(Map<String, String> raw) {
        Map<String, String> out = new HashMap<>();
        raw.forEach((k, val) -> out.put(canonical(k), val));
        return out;
    }

    private static String canonical(String key) {
        return key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
