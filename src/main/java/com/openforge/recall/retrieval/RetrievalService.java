package com.openforge.recall.retrieval;

import com.openforge.recall.arbitration.ArbitratedCandidate;
import com.openforge.recall.arbitration.ArbitrationService;
import com.openforge.recall.arbitration.ArbitrationSignalRecorder;
import com.openforge.recall.arbitration.FeedbackKind;
import com.openforge.recall.arbitration.QueryIntent;
import com.openforge.recall.belief.ActiveBeliefProvider;
import com.openforge.recall.belief.BeliefProperties;
import com.openforge.recall.candidate.Candidate;
import com.openforge.recall.candidate.ProvenanceClass;
import com.openforge.recall.embedding.EmbeddingClient;
import com.openforge.recall.embedding.EmbeddingProvider;
import com.openforge.recall.scoring.CompositeScorer;
import com.openforge.recall.scoring.ContradictionDetector;
import com.openforge.recall.scoring.ScoredCandidate;
import com.openforge.recall.scoring.ScoringContext;
import com.openforge.recall.scoring.ScoringWeightResolver;
import com.openforge.recall.scoring.ScoringWeights;
import com.openforge.recall.selection.CandidateSelector;
import com.openforge.recall.selection.MmrReranker;
import com.openforge.recall.selection.SelectionConfig;
import com.openforge.recall.selection.SelectionResult;
import com.openforge.recall.selection.SelectionStage;
import com.openforge.recall.store.FetchOutcome;
import com.openforge.recall.store.ResilientStoreAccess;
import com.openforge.recall.store.StoreFetch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Query entry point of the recall core.
 *
 * Pipeline for one query:
 *
 *   embed → ResilientStoreAccess → CandidateSelector (MMR held back)
 *         → contradiction detection → greedy composite scoring × arbitration factor
 *         → conflict resolution → MMR over final scores → topK
 *
 * Never throws for store, embedding or selection trouble: the result is then
 * empty and {@link RetrievalDiagnostics#reason()} names the cause. A vector
 * dimension mismatch is the exception and propagates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@EnableConfigurationProperties(RetrievalProperties.class)
public class RetrievalService {

    private final EmbeddingProvider         embeddings;
    private final ResilientStoreAccess      store;
    private final CandidateSelector         selector;
    private final SelectionConfig           selection;
    private final CompositeScorer           scorer;
    private final ScoringWeightResolver     weightResolver;
    private final ContradictionDetector     contradictions;
    private final ActiveBeliefProvider      beliefs;
    private final BeliefProperties          beliefProperties;
    private final ArbitrationService        arbitration;
    private final ArbitrationSignalRecorder signals;
    private final MmrReranker               mmr;
    private final RetrievalProperties       props;
    private final Clock                     clock;

    // ── Public API ───────────────────────────────────────────────────────────

    public RetrievalResult retrieve(String query) {
        return retrieve(query, props.defaultTopK());
    }

    public RetrievalResult retrieve(String query, int topK) {
        long started = System.nanoTime();
        float[] vector;
        try {
            vector = embeddings.embed(query);
        } catch (EmbeddingClient.EmbeddingException | IllegalArgumentException e) {
            log.warn("[Recall] Could not embed query: {}", e.getMessage());
            QueryIntent intent = arbitration.classify(query);
            return empty(FetchOutcome.EMPTY, RetrievalDiagnostics.Reason.EMBEDDING_FAILED,
                    null, intent, arbitration.effectiveWeights(intent), 0, started);
        }
        return retrieve(query, vector, topK);
    }

    /** Same as {@link #retrieve(String, int)} with a precomputed query vector. */
    public RetrievalResult retrieve(String query, float[] queryVector, int topK) {
        long    started = System.nanoTime();
        Instant now     = clock.instant();
        int     k       = Math.max(0, topK);

        QueryIntent                  intent    = arbitration.classify(query);
        Map<ProvenanceClass, Double> effective = arbitration.effectiveWeights(intent);

        // 1) store
        StoreFetch fetch = store.fetchWithOutcome(queryVector, props.fetchSize(k));
        if (fetch.candidates().isEmpty() || k == 0) {
            return empty(fetch.outcome(), RetrievalDiagnostics.Reason.of(fetch.outcome()),
                    null, intent, effective, fetch.candidates().size(), started);
        }

        // 2) selection; MMR runs later over composite scores
        SelectionResult selected = selector.select(query, fetch.candidates(), selection.withoutMmr());
        if (selected.isEmpty()) {
            RetrievalDiagnostics.Reason reason = selected.reason() == SelectionResult.Reason.NO_CANDIDATES
                    ? RetrievalDiagnostics.Reason.NO_CANDIDATES
                    : RetrievalDiagnostics.Reason.BELOW_THRESHOLD;
            return empty(fetch.outcome(), reason, selected, intent, effective,
                    fetch.candidates().size(), started);
        }

        // 3) scoring
        ScoringWeights weights = weightResolver.active();
        Set<String> contradicted = weights.contradictionsEnabled()
                ? contradictions.contradictedIds(selected.selected())
                : Set.of();
        ScoringContext ctx = new ScoringContext(beliefs.current(), contradicted,
                beliefProperties.importantNamespaces(), now);
        List<ScoredCandidate> ranked = scorer.rankGreedy(selected.selected(), queryVector,
                selected.selected().size(), weights, ctx, arbitration.classFactors(effective));

        // 4) arbitration
        List<ArbitratedCandidate> arbitrated = arbitration.resolveConflicts(ranked, effective, ctx.now());

        // 5) diversity
        Set<SelectionStage> stages = EnumSet.noneOf(SelectionStage.class);
        stages.addAll(selected.stages());
        if (selection.mmrEnabled() && arbitrated.size() > 1) {
            double top = Math.max(1e-9, arbitrated.stream()
                    .mapToDouble(a -> a.scored().finalScore()).max().orElse(1.0));
            arbitrated = mmr.rerank(arbitrated, selection.mmrK(), selection.mmrLambda(),
                    a -> a.scored().finalScore() / top,
                    a -> a.scored().candidate().embedding());
            stages.add(SelectionStage.MMR);
        }

        // 6) topK
        List<RankedCandidate> results = new ArrayList<>(Math.min(k, arbitrated.size()));
        double topSimilarity = 0.0;
        for (ArbitratedCandidate a : arbitrated) {
            if (results.size() >= k) break;
            ScoredCandidate sc = a.scored();
            Candidate c = sc.candidate();
            results.add(new RankedCandidate(c.id(), c.text(), sc.finalScore(), sc.breakdown(),
                    c.provenance(), a.flags()));
            topSimilarity = Math.max(topSimilarity, selected.similarityOf(c));
            if (a.flags().contains(ArbitratedCandidate.UNCERTAIN)) {
                signals.record(c.provenance(), FeedbackKind.UNCERTAIN);
            }
            if (sc.breakdown().conflictPenalty() > 0) {
                signals.record(c.provenance(), FeedbackKind.CONTRADICTED, c.conflictScore() == null
                        ? 1.0 : c.conflictScore());
            }
        }

        RetrievalStatus status = RetrievalStatus.of(results.size(), topSimilarity,
                selection.statusMinCount(), selection.statusMinSimilarity());
        long ms = elapsedMs(started);
        log.info("[Recall] intent={} hits={} selected={} returned={} status={} in {} ms",
                intent, fetch.candidates().size(), selected.selected().size(), results.size(), status, ms);

        return new RetrievalResult(results, new RetrievalDiagnostics(
                fetch.outcome(), status, null, stages, selected.thresholdUsed(),
                intent, effective, fetch.candidates().size(), ms));
    }

    /** Downstream judgement of a returned result, fed to the arbitration learning window. */
    public void recordFeedback(RankedCandidate result, FeedbackKind kind) {
        signals.record(result.provenance(), kind);
    }

    public void recordFeedback(RankedCandidate result, FeedbackKind kind, double value) {
        signals.record(result.provenance(), kind, value);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private RetrievalResult empty(FetchOutcome outcome,
                                  RetrievalDiagnostics.Reason reason,
                                  @Nullable SelectionResult selected,
                                  QueryIntent intent,
                                  Map<ProvenanceClass, Double> effective,
                                  int rawHits,
                                  long started) {
        long ms = elapsedMs(started);
        if (outcome == FetchOutcome.CIRCUIT_OPEN) {
            log.warn("[Recall] No results: vector store circuit open");
        } else {
            log.info("[Recall] No results ({}) after {} raw hit(s) in {} ms", reason.code(), rawHits, ms);
        }
        return new RetrievalResult(List.of(), new RetrievalDiagnostics(
                outcome,
                RetrievalStatus.NONE,
                reason,
                selected == null ? Set.of() : selected.stages(),
                selected == null ? selection.threshold() : selected.thresholdUsed(),
                intent,
                effective,
                rawHits,
                ms));
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
