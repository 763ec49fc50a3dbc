package com.openforge.recall.arbitration;

import com.openforge.recall.candidate.Candidate;
import com.openforge.recall.candidate.ProvenanceClass;
import com.openforge.recall.scoring.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Intent-sensitive weighting of provenance classes, plus resolution of
 * candidates that assert the same thing.
 *
 * Effective weight of class c for intent i:
 *
 *   eff[c] ∝ base[c] * mult[i][c] * profile[c],   Σ eff = 1
 *
 * The multiplier is dropped in STATIC mode and the learned profile is
 * uniform unless learning is enabled. A candidate's composite score is
 * multiplied by {@code 4 * eff[c]}, so uniform weights change nothing.
 *
 * When disabled every factor is 1.0 and conflicts are left alone.
 */
@Slf4j
@Service
@EnableConfigurationProperties(ArbitrationProperties.class)
public class ArbitrationService {

    private static final int CLASSES = ProvenanceClass.values().length;

    private final ArbitrationProperties    props;
    private final ArbitrationProfileHolder profiles;
    private final IntentClassifier         classifier;

    public ArbitrationService(ArbitrationProperties props,
                              ArbitrationProfileHolder profiles,
                              IntentClassifier classifier) {
        this.props      = props;
        this.profiles   = profiles;
        this.classifier = classifier;
        log.info("[Arbitration] {} (mode={}, policy={}, learning={})",
                props.enabled() ? "Enabled" : "Disabled", props.mode(), props.conflictPolicy(),
                props.learning().enabled() ? (props.learning().observeOnly() ? "observe-only" : "on") : "off");
    }

    public boolean enabled() {
        return props.enabled();
    }

    public QueryIntent classify(String query) {
        return classifier.classify(query);
    }

    // ── Weights ──────────────────────────────────────────────────────────────

    public Map<ProvenanceClass, Double> effectiveWeights(QueryIntent intent) {
        Map<ProvenanceClass, Double> out = new EnumMap<>(ProvenanceClass.class);
        if (!props.enabled()) {
            for (ProvenanceClass c : ProvenanceClass.values()) out.put(c, 1.0 / CLASSES);
            return out;
        }

        ArbitrationProfile profile = props.learning().enabled()
                ? profiles.current()
                : ArbitrationProfile.uniform();
        double total = 0.0;
        for (ProvenanceClass c : ProvenanceClass.values()) {
            double w = props.baseWeight(c) * profile.get(c);
            if (props.mode() == ArbitrationProperties.Mode.CONTEXT) {
                w *= props.multiplier(intent, c);
            }
            out.put(c, w);
            total += w;
        }
        if (total <= 0) {
            for (ProvenanceClass c : ProvenanceClass.values()) out.put(c, 1.0 / CLASSES);
            return out;
        }
        for (ProvenanceClass c : ProvenanceClass.values()) {
            out.put(c, out.get(c) / total);
        }
        return out;
    }

    /** Per-candidate multiplier for the composite score; 1.0 everywhere when disabled. */
    public ToDoubleFunction<Candidate> classFactors(Map<ProvenanceClass, Double> effective) {
        if (!props.enabled()) return c -> 1.0;
        Map<ProvenanceClass, Double> factors = new EnumMap<>(ProvenanceClass.class);
        effective.forEach((c, w) -> factors.put(c, CLASSES * w));
        return c -> factors.getOrDefault(c.provenance(), 1.0);
    }

    // ── Conflicts ────────────────────────────────────────────────────────────

    /**
     * Settles candidates sharing an assertion key. The winner takes the rank of
     * the group's best-placed member; the others are tagged superseded and keep
     * their later slots. Candidates without a key pass through unchanged.
     * {@code now} is the query instant; RECENCY treats an undated member as that old.
     */
    public List<ArbitratedCandidate> resolveConflicts(List<ScoredCandidate> ranked,
                                                      Map<ProvenanceClass, Double> effective,
                                                      Instant now) {
        List<ArbitratedCandidate> out = new ArrayList<>(ranked.size());
        if (!props.enabled()) {
            ranked.forEach(sc -> out.add(ArbitratedCandidate.plain(sc)));
            return out;
        }

        Map<String, List<ScoredCandidate>> groups = new LinkedHashMap<>();
        for (ScoredCandidate sc : ranked) {
            String key = sc.candidate().assertionKey();
            if (key != null && !key.isBlank()) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(sc);
            }
        }

        Map<String, Resolution> resolutions = new HashMap<>();
        groups.forEach((key, members) -> {
            if (members.size() > 1) resolutions.put(key, resolve(members, effective, now));
        });

        Map<String, List<ScoredCandidate>> slotsLeft = new HashMap<>();
        resolutions.forEach((key, r) -> slotsLeft.put(key, new ArrayList<>(r.order())));

        for (ScoredCandidate sc : ranked) {
            String key = sc.candidate().assertionKey();
            Resolution r = key == null ? null : resolutions.get(key);
            if (r == null) {
                out.add(ArbitratedCandidate.plain(sc));
                continue;
            }
            ScoredCandidate next = slotsLeft.get(key).remove(0);
            out.add(new ArbitratedCandidate(next, r.flags().getOrDefault(next.id(), Set.of())));
        }
        return out;
    }

    private record Resolution(List<ScoredCandidate> order, Map<String, Set<String>> flags) {}

    private Resolution resolve(List<ScoredCandidate> members, Map<ProvenanceClass, Double> effective,
                               Instant now) {
        List<ScoredCandidate> byConfidence = new ArrayList<>(members);
        byConfidence.sort(Comparator.comparingDouble((ScoredCandidate sc) -> sc.candidate().confidence())
                .reversed()
                .thenComparing(Comparator.comparingDouble(ScoredCandidate::finalScore).reversed()));
        double gap = byConfidence.get(0).candidate().confidence() - byConfidence.get(1).candidate().confidence();

        Map<String, Set<String>> flags = new HashMap<>();
        ScoredCandidate winner;
        if (gap > props.conflictEpsilon()) {
            winner = byConfidence.get(0);
        } else {
            switch (props.conflictPolicy()) {
                case UNCERTAIN -> {
                    members.forEach(sc -> flags.put(sc.id(), Set.of(ArbitratedCandidate.UNCERTAIN)));
                    log.debug("[Arbitration] Conflict on '{}' left open ({} members)",
                            members.get(0).candidate().assertionKey(), members.size());
                    return new Resolution(members, flags);
                }
                case CONFIDENCE -> winner = byConfidence.get(0);
                case RECENCY -> winner = newest(members, now);
                default -> {
                    winner = members.stream()
                            .max(Comparator.comparingDouble((ScoredCandidate sc) ->
                                            effective.getOrDefault(sc.candidate().provenance(), 0.0))
                                    .thenComparingDouble(ScoredCandidate::finalScore))
                            .orElseThrow();
                    if (gap < props.uncertainThreshold()) {
                        flags.put(winner.id(), new HashSet<>(Set.of(ArbitratedCandidate.UNCERTAIN)));
                    }
                }
            }
        }

        List<ScoredCandidate> order = new ArrayList<>(members.size());
        order.add(winner);
        for (ScoredCandidate sc : members) {
            if (sc == winner) continue;
            order.add(sc);
            flags.computeIfAbsent(sc.id(), k -> new HashSet<>()).add(ArbitratedCandidate.SUPERSEDED);
        }
        log.debug("[Arbitration] Conflict on '{}' won by {} (confidence gap {})",
                winner.candidate().assertionKey(), winner.id(), gap);
        return new Resolution(order, flags);
    }

    /** Newest first; a missing timestamp counts as {@code now}. Ties go to the higher score. */
    private static ScoredCandidate newest(List<ScoredCandidate> members, Instant now) {
        return members.stream()
                .max(Comparator.comparing((ScoredCandidate sc) ->
                                sc.candidate().timestamp() == null ? now : sc.candidate().timestamp())
                        .thenComparingDouble(ScoredCandidate::finalScore))
                .orElseThrow();
    }
}
