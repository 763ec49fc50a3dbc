package com.openforge.recall.arbitration;

import com.openforge.recall.candidate.ProvenanceClass;
import com.openforge.recall.candidate.Vectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Trailing window of feedback events. Oldest events fall out once the window
 * is full. Safe to call from query threads.
 */
@Slf4j
@Component
public class ArbitrationSignalRecorder {

    record FeedbackEvent(ProvenanceClass provenance, FeedbackKind kind, double value) {}

    private final int window;
    private final Deque<FeedbackEvent> events = new ArrayDeque<>();

    @Autowired
    public ArbitrationSignalRecorder(ArbitrationProperties props) {
        this(props.learning().window());
    }

    ArbitrationSignalRecorder(int window) {
        this.window = Math.max(1, window);
    }

    public void record(ProvenanceClass provenance, FeedbackKind kind) {
        record(provenance, kind, 1.0);
    }

    public void record(ProvenanceClass provenance, FeedbackKind kind, double value) {
        FeedbackEvent e = new FeedbackEvent(provenance, kind, Vectors.clamp01(value));
        synchronized (events) {
            events.addLast(e);
            while (events.size() > window) events.removeFirst();
        }
        log.trace("[Arbitration] Feedback {} {} {}", provenance, kind, value);
    }

    public int size() {
        synchronized (events) {
            return events.size();
        }
    }

    public ArbitrationSignals snapshot() {
        List<FeedbackEvent> copy;
        synchronized (events) {
            copy = List.copyOf(events);
        }

        Map<ProvenanceClass, int[]>    counts = new EnumMap<>(ProvenanceClass.class);
        Map<ProvenanceClass, double[]> sums   = new EnumMap<>(ProvenanceClass.class);
        for (ProvenanceClass c : ProvenanceClass.values()) {
            counts.put(c, new int[FeedbackKind.values().length + 1]);
            sums.put(c, new double[FeedbackKind.values().length]);
        }
        for (FeedbackEvent e : copy) {
            int[] n = counts.get(e.provenance());
            n[e.kind().ordinal()]++;
            n[FeedbackKind.values().length]++;
            sums.get(e.provenance())[e.kind().ordinal()] += e.value();
        }

        Map<ProvenanceClass, ArbitrationSignals.ClassSignals> byClass = new EnumMap<>(ProvenanceClass.class);
        for (ProvenanceClass c : ProvenanceClass.values()) {
            int[]    n     = counts.get(c);
            double[] s     = sums.get(c);
            int      total = n[FeedbackKind.values().length];
            if (total == 0) continue;

            int kept      = n[FeedbackKind.KEPT.ordinal()];
            int dropped   = n[FeedbackKind.DROPPED.ordinal()];
            int useful    = n[FeedbackKind.USEFUL.ordinal()];
            int reinforce = n[FeedbackKind.REINFORCED.ordinal()];
            int decay     = n[FeedbackKind.DECAYED.ordinal()];

            byClass.put(c, new ArbitrationSignals.ClassSignals(
                    total,
                    kept + dropped == 0 ? 0.5 : (double) kept / (kept + dropped),
                    (double) n[FeedbackKind.UNCERTAIN.ordinal()] / total,
                    Math.min(1.0, s[FeedbackKind.CONTRADICTED.ordinal()] / total),
                    useful == 0 ? 0.5 : s[FeedbackKind.USEFUL.ordinal()] / useful,
                    reinforce + decay == 0 ? 0.0 : (double) (reinforce - decay) / (reinforce + decay)));
        }
        return new ArbitrationSignals(byClass, copy.size());
    }
}
