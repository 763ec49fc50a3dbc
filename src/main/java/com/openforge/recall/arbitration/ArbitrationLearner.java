package com.openforge.recall.arbitration;

import com.openforge.recall.candidate.ProvenanceClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Slow adaptation of the {@link ArbitrationProfile} from downstream feedback.
 *
 * One cycle turns the trailing feedback window into a per-class delta, then
 * applies it with hard stability bounds: each component is clamped to
 * {@code ±maxShift} and damped, the step is made zero-sum without pushing any
 * class below the floor, and the result is renormalized. No class ever moves
 * by more than {@code maxShift} in one cycle and the weights always sum to 1.
 *
 * Cycles are serialized; queries keep reading the previous snapshot until
 * the new one is swapped in.
 */
@Slf4j
@Component
public class ArbitrationLearner {

    /** Outcome of one learning cycle. */
    public enum Outcome { DISABLED, SKIPPED, OBSERVED, APPLIED }

    public record CycleResult(Outcome outcome, ArbitrationProfile before, ArbitrationProfile proposed) {}

    private static final double W_KEPT          = 1.0;
    private static final double W_USEFUL        = 1.0;
    private static final double W_REINFORCEMENT = 0.5;
    private static final double W_UNCERTAIN     = 1.0;
    private static final double W_CONTRADICTION = 1.0;

    private static final int BISECTION_STEPS = 100;

    private final ArbitrationProperties.Learning cfg;
    private final ArbitrationProfileHolder       holder;
    private final ArbitrationProfileStore        store;
    private final ArbitrationSignalRecorder      recorder;

    public ArbitrationLearner(ArbitrationProperties props,
                              ArbitrationProfileHolder holder,
                              ArbitrationProfileStore store,
                              ArbitrationSignalRecorder recorder) {
        this.cfg      = props.learning();
        this.holder   = holder;
        this.store    = store;
        this.recorder = recorder;
    }

    // ── Cycle ────────────────────────────────────────────────────────────────

    public synchronized CycleResult runCycle() {
        ArbitrationProfile before = holder.current();
        if (!cfg.enabled()) {
            return new CycleResult(Outcome.DISABLED, before, before);
        }

        ArbitrationSignals signals = recorder.snapshot();
        if (signals.totalEvents() < cfg.minEvents()) {
            log.debug("[Arbitration] Learning skipped: {} events in window, need {}",
                    signals.totalEvents(), cfg.minEvents());
            return new CycleResult(Outcome.SKIPPED, before, before);
        }

        Map<ProvenanceClass, Double> delta = proposeDelta(signals);
        ArbitrationProfile proposed = applyDelta(before, delta);

        if (cfg.observeOnly()) {
            log.info("[Arbitration] Observe-only: delta {} would move {} -> {}", delta, before, proposed);
            return new CycleResult(Outcome.OBSERVED, before, proposed);
        }

        holder.swap(proposed);
        try {
            store.save(proposed);
        } catch (IOException e) {
            log.warn("[Arbitration] Could not persist profile to {}: {} (kept in memory)",
                    store.path(), e.getMessage());
        }
        log.info("[Arbitration] Profile updated {} -> {}", before, proposed);
        return new CycleResult(Outcome.APPLIED, before, proposed);
    }

    // ── Proposal ─────────────────────────────────────────────────────────────

    /**
     * Positive for classes whose items are kept, rated useful and reinforced;
     * negative for classes that draw uncertainty or contradictions. Classes
     * with no feedback get 0.
     */
    public Map<ProvenanceClass, Double> proposeDelta(ArbitrationSignals signals) {
        Map<ProvenanceClass, Double> delta = new EnumMap<>(ProvenanceClass.class);
        for (ProvenanceClass c : ProvenanceClass.values()) {
            ArbitrationSignals.ClassSignals s = signals.of(c);
            if (s.events() == 0) {
                delta.put(c, 0.0);
                continue;
            }
            double d = W_KEPT * (s.keptRate() - 0.5)
                    + W_USEFUL * (s.usefulness() - 0.5)
                    + W_REINFORCEMENT * s.reinforcement()
                    - W_UNCERTAIN * s.uncertainRate()
                    - W_CONTRADICTION * s.contradictionSeverity();
            delta.put(c, d);
        }
        return delta;
    }

    // ── Bounded application ──────────────────────────────────────────────────

    public ArbitrationProfile applyDelta(ArbitrationProfile profile, Map<ProvenanceClass, Double> delta) {
        return applyDelta(profile, delta, cfg.maxShift(), cfg.damping(), cfg.floor());
    }

    static ArbitrationProfile applyDelta(ArbitrationProfile profile,
                                         Map<ProvenanceClass, Double> delta,
                                         double maxShift,
                                         double damping,
                                         double floor) {
        double[] old = profile.sanitized(floor).toArray();
        ProvenanceClass[] classes = ProvenanceClass.values();
        int n = classes.length;

        double[] wanted = new double[n];
        double[] lo     = new double[n];
        double[] hi     = new double[n];
        for (int i = 0; i < n; i++) {
            double d = delta.getOrDefault(classes[i], 0.0);
            if (!Double.isFinite(d)) d = 0.0;
            wanted[i] = clamp(d, -maxShift, maxShift) * damping;
            lo[i]     = Math.min(0.0, Math.max(-maxShift, floor - old[i]));
            hi[i]     = maxShift;
        }

        // find λ with Σ clamp(wanted - λ, lo, hi) = 0; the sum falls as λ grows
        double left = -2.0, right = 2.0;
        for (int it = 0; it < BISECTION_STEPS; it++) {
            double mid = (left + right) / 2;
            if (stepSum(wanted, lo, hi, mid) > 0) left = mid;
            else right = mid;
        }
        double lambda = (left + right) / 2;

        double[] next = new double[n];
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            next[i] = Math.max(floor, old[i] + clamp(wanted[i] - lambda, lo[i], hi[i]));
            total  += next[i];
        }
        for (int i = 0; i < n; i++) {
            next[i] /= total;
        }
        return ArbitrationProfile.of(next);
    }

    private static double stepSum(double[] wanted, double[] lo, double[] hi, double lambda) {
        double sum = 0.0;
        for (int i = 0; i < wanted.length; i++) {
            sum += clamp(wanted[i] - lambda, lo[i], hi[i]);
        }
        return sum;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
