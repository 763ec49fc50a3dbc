package com.openforge.recall.scoring;

import com.openforge.recall.belief.ActiveBeliefSet;
import com.openforge.recall.candidate.Candidate;
import com.openforge.recall.candidate.CandidateNormalizer;
import com.openforge.recall.candidate.ProvenanceClass;
import com.openforge.recall.candidate.VectorDimensionMismatchException;
import com.openforge.recall.store.StoreHit;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CompositeScorerTest {

    private static final Instant NOW   = Instant.parse("2025-01-15T12:00:00Z");
    private static final float[] QUERY = {1f, 0f};

    private final CompositeScorer scorer = new CompositeScorer(0);
    private final ScoringWeights  w      = ScoringWeights.DEFAULTS;
    private final ScoringContext  ctx    = ScoringContext.at(NOW);

    @Test
    void recentCandidateBeatsOldOneWithSameSimilarity() {
        Candidate a = candidate("A", new float[]{1f, 0f}, 1.0).timestamp(NOW).build();
        Candidate b = candidate("B", new float[]{1f, 0f}, 1.0).timestamp(NOW.minus(Duration.ofDays(30))).build();

        double scoreA = scorer.score(a, QUERY, List.of(), w, ctx).finalScore();
        double scoreB = scorer.score(b, QUERY, List.of(), w, ctx).finalScore();

        assertThat(scoreA).isGreaterThan(scoreB);
    }

    @Test
    void higherSimilarityScoresHigherAllElseEqual() {
        Candidate close = candidate("close", new float[]{1f, 0f}, 1.0).build();
        Candidate far   = candidate("far", new float[]{0.6f, 0.8f}, 0.6).build();

        assertThat(scorer.score(close, QUERY, List.of(), w, ctx).finalScore())
                .isGreaterThan(scorer.score(far, QUERY, List.of(), w, ctx).finalScore());
    }

    @Test
    void recencyIsMonotoneInAge() {
        double previous = Double.MAX_VALUE;
        for (int days = 0; days <= 365; days += 15) {
            Candidate c = candidate("c", new float[]{1f, 0f}, 1.0)
                    .timestamp(NOW.minus(Duration.ofDays(days))).build();
            double s = scorer.score(c, QUERY, List.of(), w, ctx).finalScore();
            assertThat(s).isLessThanOrEqualTo(previous);
            previous = s;
        }
    }

    @Test
    void missingTimestampCountsAsFresh() {
        assertThat(CompositeScorer.recency(null, NOW, 0.015)).isEqualTo(1.0);
        assertThat(CompositeScorer.recency(NOW.plus(Duration.ofDays(2)), NOW, 0.015)).isEqualTo(1.0);
        assertThat(CompositeScorer.recency(NOW.minus(Duration.ofDays(10)), NOW, 0.015))
                .isCloseTo(Math.exp(-0.15), within(1e-9));
    }

    @Test
    void defaultWeightsMatchTheDocumentedFormula() {
        Candidate c = candidate("c", new float[]{1f, 0f}, 1.0)
                .timestamp(NOW)
                .sourceTrust(0.8)
                .confidence(0.7)
                .timesUsed(10)
                .build();

        ScoredCandidate sc = scorer.score(c, QUERY, List.of(), w, ctx);
        ScoreBreakdown b = sc.breakdown();

        double alignment = 0.1;   // both tag sets empty
        double usage     = 1 - Math.exp(-1.0);
        double expected  = 1.0
                * (1 + 0.6 * 1.0)
                * (1 + 0.5 * (0.8 - 0.5))
                * (1 + 0.3 * (0.7 - 0.5))
                * (1 + 0.4 * (alignment - 0.5))
                * (1 + 0.2 * usage);
        assertThat(b.similarity()).isCloseTo(1.0, within(1e-9));
        assertThat(b.beliefAlignment()).isCloseTo(alignment, within(1e-9));
        assertThat(b.usage()).isCloseTo(usage, within(1e-9));
        assertThat(b.novelty()).isZero();
        assertThat(b.arbitrationFactor()).isEqualTo(1.0);
        assertThat(sc.finalScore()).isCloseTo(expected, within(1e-9));
    }

    @Test
    void candidateWithoutEmbeddingScoresZero() {
        Candidate c = candidate("none", null, 0.9).build();

        ScoredCandidate sc = scorer.score(c, QUERY, List.of(), w, ctx);

        assertThat(sc.finalScore()).isZero();
        assertThat(sc.breakdown()).isEqualTo(ScoreBreakdown.zero());
    }

    @Test
    void dimensionMismatchIsAHardError() {
        Candidate c = candidate("3d", new float[]{1f, 0f, 0f}, 0.9).build();

        assertThatThrownBy(() -> scorer.score(c, QUERY, List.of(), w, ctx))
                .isInstanceOf(VectorDimensionMismatchException.class);
    }

    @Test
    void contradictionPenaltyAppliesOnlyWhenEnabledAndFlagged() {
        Candidate c = candidate("x", new float[]{1f, 0f}, 1.0).build();
        ScoringContext flagged = ctx.withContradictedIds(Set.of("x"));

        double clean     = scorer.score(c, QUERY, List.of(), w, ctx).finalScore();
        double penalized = scorer.score(c, QUERY, List.of(), w, flagged).finalScore();
        double disabled  = scorer.score(c, QUERY, List.of(),
                w.toBuilder().contradictionsEnabled(false).build(), flagged).finalScore();

        assertThat(penalized).isCloseTo(clean * 0.95, within(1e-9));
        assertThat(disabled).isCloseTo(clean, within(1e-9));
    }

    @Test
    void payloadFlagAlsoTriggersPenalty() {
        Candidate c = candidate("x", new float[]{1f, 0f}, 1.0).conflictScore(0.3).build();

        assertThat(scorer.score(c, QUERY, List.of(), w, ctx).breakdown().conflictPenalty()).isEqualTo(0.05);
    }

    @Test
    void beliefAlignmentUsesSmoothedJaccardAndImportantBoost() {
        double plain = CompositeScorer.beliefAlignment(Set.of("a", "b"), Set.of("b", "c"), 0.1, 0.1, List.of());
        assertThat(plain).isCloseTo((1 + 0.1) / (3 + 0.1), within(1e-9));

        double boosted = CompositeScorer.beliefAlignment(Set.of("core.identity.honesty"),
                Set.of("core.identity.honesty"), 0.1, 0.1, List.of("core.identity"));
        assertThat(boosted).isEqualTo(1.0);

        double oneEmpty = CompositeScorer.beliefAlignment(Set.of(), Set.of("a"), 0.1, 0.1, List.of());
        assertThat(oneEmpty).isCloseTo(0.1 / 1.1, within(1e-9));

        double bothEmpty = CompositeScorer.beliefAlignment(Set.of(), Set.of(), 0.1, 0.1, List.of());
        assertThat(bothEmpty).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void untaggedCandidateDoesNotOutrankTaggedTwinWithoutActiveBeliefs() {
        Candidate untagged = candidate("untagged", new float[]{1f, 0f}, 0.9).timestamp(NOW).build();
        Candidate tagged   = candidate("tagged", new float[]{1f, 0f}, 0.9).timestamp(NOW)
                .beliefTags(Set.of("x")).build();

        double untaggedScore = scorer.score(untagged, QUERY, List.of(), w, ctx).finalScore();
        double taggedScore   = scorer.score(tagged, QUERY, List.of(), w, ctx).finalScore();

        assertThat(taggedScore / untaggedScore).isGreaterThan(0.99);
    }

    @Test
    void malformedVectorDoesNotPoisonTheBatch() {
        CandidateNormalizer normalizer = new CandidateNormalizer();
        Candidate good = normalizer.normalize(new StoreHit("good", 0.9,
                Map.of("vector", List.of(1.0, 0.0)), null));
        Candidate bad = normalizer.normalize(new StoreHit("bad", 0.9,
                Map.of("vector", List.of(Double.NaN, 0.0)), null));

        List<ScoredCandidate> ranked = scorer.rankGreedy(List.of(good, bad), QUERY, 2, w, ctx, c -> 1.0);

        assertThat(ranked).extracting(ScoredCandidate::id).containsExactly("good", "bad");
        assertThat(ranked).allSatisfy(sc -> assertThat(sc.finalScore()).isNotNaN());
        assertThat(ranked.get(1).finalScore()).isZero();
    }

    @Test
    void activeBeliefsRaiseAlignedCandidates() {
        ScoringContext withBeliefs = new ScoringContext(ActiveBeliefSet.of("project.recall"), Set.of(), List.of(), NOW);
        Candidate aligned   = candidate("aligned", new float[]{1f, 0f}, 1.0).beliefTags(Set.of("project.recall")).build();
        Candidate unrelated = candidate("unrelated", new float[]{1f, 0f}, 1.0).beliefTags(Set.of("other")).build();

        assertThat(scorer.score(aligned, QUERY, List.of(), w, withBeliefs).finalScore())
                .isGreaterThan(scorer.score(unrelated, QUERY, List.of(), w, withBeliefs).finalScore());
    }

    @Test
    void scoringIsDeterministic() {
        Candidate c = candidate("c", new float[]{0.8f, 0.6f}, 0.8).timestamp(NOW.minus(Duration.ofDays(3))).build();
        List<Candidate> selected = List.of(candidate("s", new float[]{0f, 1f}, 0.5).build());

        assertThat(scorer.score(c, QUERY, selected, w, ctx))
                .isEqualTo(scorer.score(c, QUERY, selected, w, ctx));
    }

    @Test
    void greedyRankingRewardsNoveltyAndBreaksTiesById() {
        ScoringWeights noveltyHeavy = w.toBuilder().wNov(3.0).build();
        Candidate a     = candidate("a", new float[]{1f, 0f}, 1.0).build();
        Candidate aCopy = candidate("a-copy", new float[]{1f, 0f}, 1.0).build();
        Candidate other = candidate("other", new float[]{0.9f, 0.43589f}, 0.9).build();

        List<ScoredCandidate> ranked = scorer.rankGreedy(List.of(aCopy, other, a), QUERY, 3, noveltyHeavy, ctx, c -> 1.0);

        // a and a-copy tie on the first pick; once a is in, its duplicate brings nothing new
        assertThat(ranked).extracting(ScoredCandidate::id).containsExactly("a", "other", "a-copy");
        assertThat(ranked.get(1).breakdown().novelty()).isGreaterThan(0.0);
        assertThat(ranked.get(2).breakdown().novelty()).isLessThan(ranked.get(1).breakdown().novelty());
    }

    @Test
    void greedyRankingAppliesClassFactorAndLimit() {
        Candidate base = candidate("base", new float[]{1f, 0f}, 1.0).build();
        Candidate proc = candidate("proc", new float[]{1f, 0f}, 1.0).provenance(ProvenanceClass.PROCEDURAL).build();

        List<ScoredCandidate> ranked = scorer.rankGreedy(List.of(base, proc), QUERY, 1, w, ctx,
                c -> c.provenance() == ProvenanceClass.PROCEDURAL ? 1.5 : 0.5);

        assertThat(ranked).hasSize(1);
        assertThat(ranked.get(0).id()).isEqualTo("proc");
        assertThat(ranked.get(0).breakdown().arbitrationFactor()).isEqualTo(1.5);
        assertThat(ranked.get(0).breakdown().compositeScore() * 1.5)
                .isCloseTo(ranked.get(0).finalScore(), within(1e-9));
    }

    @Test
    void parallelRankingMatchesSequential() {
        List<Candidate> pool = new java.util.ArrayList<>();
        for (int i = 0; i < 40; i++) {
            double angle = i * 0.02;
            pool.add(candidate("c" + i, new float[]{(float) Math.cos(angle), (float) Math.sin(angle)}, 0.9)
                    .timestamp(NOW.minus(Duration.ofDays(i % 7))).build());
        }

        List<ScoredCandidate> sequential = new CompositeScorer(0).rankGreedy(pool, QUERY, 10, w, ctx, c -> 1.0);
        List<ScoredCandidate> parallel   = new CompositeScorer(8).rankGreedy(pool, QUERY, 10, w, ctx, c -> 1.0);

        assertThat(parallel).isEqualTo(sequential);
    }

    private static Candidate.CandidateBuilder candidate(String id, float[] embedding, double similarity) {
        return Candidate.builder()
                .id(id)
                .embedding(embedding)
                .rawSimilarity(similarity)
                .sourceTrust(Candidate.DEFAULT_SOURCE_TRUST)
                .confidence(Candidate.DEFAULT_CONFIDENCE)
                .importance(Candidate.DEFAULT_IMPORTANCE);
    }
}
