package com.openforge.recall.store;

import com.openforge.recall.candidate.CandidateNormalizer;
import com.openforge.recall.config.Resilience4jConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ResilientStoreAccessTest {

    private static final float[] QUERY  = {1f, 0f};
    private static final Instant OPENED = Instant.parse("2025-01-15T12:00:00Z");

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final FakeStore       store    = new FakeStore();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
        Thread.interrupted();
    }

    @Test
    void breakerOpensAfterThreeTimeoutsAndFourthCallSkipsTheStore() {
        ResilientStoreAccess access = access(props(Duration.ofMillis(80), 0, Duration.ofSeconds(30)));
        store.behaviour = Behaviour.HANG;

        for (int i = 0; i < 3; i++) {
            StoreFetch f = access.fetchWithOutcome(QUERY, 5);
            assertThat(f.outcome()).isEqualTo(FetchOutcome.TIMEOUT);
            assertThat(f.candidates()).isEmpty();
        }
        assertThat(access.isOpen()).isTrue();
        assertThat(access.breakerSnapshot().consecutiveFailures()).isEqualTo(3);
        assertThat(access.breakerSnapshot().openedAt()).isEqualTo(OPENED);

        StoreFetch rejected = access.fetchWithOutcome(QUERY, 5);

        assertThat(rejected.outcome()).isEqualTo(FetchOutcome.CIRCUIT_OPEN);
        assertThat(rejected.candidates()).isEmpty();
        assertThat(rejected.attempts()).isZero();
        assertThat(store.calls.get()).isEqualTo(3);
    }

    @Test
    void successfulTrialAfterOpenDurationClosesAndResetsCounter() throws Exception {
        ResilientStoreAccess access = access(props(Duration.ofSeconds(1), 0, Duration.ofMillis(200)));
        store.behaviour = Behaviour.FAIL;
        for (int i = 0; i < 3; i++) access.fetch(QUERY, 5);
        assertThat(access.isOpen()).isTrue();

        TimeUnit.MILLISECONDS.sleep(300);
        store.behaviour = Behaviour.OK;
        StoreFetch trial = access.fetchWithOutcome(QUERY, 5);

        assertThat(trial.outcome()).isEqualTo(FetchOutcome.OK);
        assertThat(trial.candidates()).extracting(c -> c.id()).containsExactly("m1");
        assertThat(access.breakerSnapshot().state()).isEqualTo(BreakerSnapshot.State.CLOSED);
        assertThat(access.breakerSnapshot().consecutiveFailures()).isZero();
    }

    @Test
    void failedTrialReopensTheBreaker() throws Exception {
        ResilientStoreAccess access = access(props(Duration.ofSeconds(1), 0, Duration.ofMillis(200)));
        store.behaviour = Behaviour.FAIL;
        for (int i = 0; i < 3; i++) access.fetch(QUERY, 5);

        TimeUnit.MILLISECONDS.sleep(300);
        StoreFetch trial = access.fetchWithOutcome(QUERY, 5);

        assertThat(trial.outcome()).isEqualTo(FetchOutcome.STORE_ERROR);
        assertThat(access.isOpen()).isTrue();
        assertThat(access.fetchWithOutcome(QUERY, 5).outcome()).isEqualTo(FetchOutcome.CIRCUIT_OPEN);
    }

    @Test
    void halfOpenAdmitsASingleTrialCall() throws Exception {
        ResilientStoreAccess access = access(props(Duration.ofSeconds(2), 0, Duration.ofMillis(200)));
        store.behaviour = Behaviour.FAIL;
        for (int i = 0; i < 3; i++) access.fetch(QUERY, 5);
        TimeUnit.MILLISECONDS.sleep(300);

        store.behaviour = Behaviour.SLOW_OK;
        CompletableFuture<StoreFetch> trial = CompletableFuture.supplyAsync(() -> access.fetchWithOutcome(QUERY, 5));
        TimeUnit.MILLISECONDS.sleep(100);
        StoreFetch concurrent = access.fetchWithOutcome(QUERY, 5);

        assertThat(concurrent.outcome()).isEqualTo(FetchOutcome.CIRCUIT_OPEN);
        assertThat(trial.get(5, TimeUnit.SECONDS).outcome()).isEqualTo(FetchOutcome.OK);
        assertThat(access.breakerSnapshot().state()).isEqualTo(BreakerSnapshot.State.CLOSED);
    }

    @Test
    void transientFailuresAreRetriedWithinOneLogicalCall() {
        ResilientStoreAccess access = access(props(Duration.ofSeconds(1), 2, Duration.ofSeconds(30)));
        store.behaviour = Behaviour.FAIL_TWICE_THEN_OK;

        StoreFetch f = access.fetchWithOutcome(QUERY, 5);

        assertThat(f.outcome()).isEqualTo(FetchOutcome.OK);
        assertThat(f.attempts()).isEqualTo(3);
        assertThat(access.breakerSnapshot().consecutiveFailures()).isZero();
        assertThat(access.isOpen()).isFalse();
    }

    @Test
    void exhaustedRetriesCountAsOneFailure() {
        ResilientStoreAccess access = access(props(Duration.ofSeconds(1), 2, Duration.ofSeconds(30)));
        store.behaviour = Behaviour.FAIL;

        StoreFetch f = access.fetchWithOutcome(QUERY, 5);

        assertThat(f.outcome()).isEqualTo(FetchOutcome.STORE_ERROR);
        assertThat(f.attempts()).isEqualTo(3);
        assertThat(store.calls.get()).isEqualTo(3);
        assertThat(access.breakerSnapshot().consecutiveFailures()).isEqualTo(1);
        assertThat(access.isOpen()).isFalse();
    }

    @Test
    void healthyEmptyAnswerIsNotAFailure() {
        ResilientStoreAccess access = access(props(Duration.ofSeconds(1), 0, Duration.ofSeconds(30)));
        store.behaviour = Behaviour.EMPTY;

        StoreFetch f = access.fetchWithOutcome(QUERY, 5);

        assertThat(f.outcome()).isEqualTo(FetchOutcome.EMPTY);
        assertThat(f.outcome().isFailure()).isFalse();
        assertThat(access.breakerSnapshot().consecutiveFailures()).isZero();
    }

    @Test
    void interruptedCallerIsCancelledWithoutTouchingTheBreaker() {
        ResilientStoreAccess access = access(props(Duration.ofSeconds(1), 2, Duration.ofSeconds(30)));
        store.behaviour = Behaviour.OK;

        Thread.currentThread().interrupt();
        StoreFetch f = access.fetchWithOutcome(QUERY, 5);
        Thread.interrupted();

        assertThat(f.outcome()).isEqualTo(FetchOutcome.CANCELLED);
        assertThat(store.calls.get()).isZero();
        assertThat(access.breakerSnapshot().consecutiveFailures()).isZero();
        assertThat(access.breakerSnapshot().state()).isEqualTo(BreakerSnapshot.State.CLOSED);
    }

    @Test
    void missingVectorNeverReachesTheStore() {
        ResilientStoreAccess access = access(props(Duration.ofSeconds(1), 0, Duration.ofSeconds(30)));

        assertThat(access.fetchWithOutcome(null, 5).outcome()).isEqualTo(FetchOutcome.EMPTY);
        assertThat(access.fetchWithOutcome(QUERY, 0).outcome()).isEqualTo(FetchOutcome.EMPTY);
        assertThat(store.calls.get()).isZero();
    }

    // ── Fixtures ─────────────────────────────────────────────────────────────

    private static StoreProperties props(Duration timeout, int retries, Duration openDuration) {
        return new StoreProperties(timeout, retries, Duration.ofMillis(5), 0.0, 3, openDuration, 4);
    }

    private ResilientStoreAccess access(StoreProperties props) {
        return new ResilientStoreAccess(
                store,
                new CandidateNormalizer(),
                props,
                CircuitBreaker.of(Resilience4jConfig.VECTOR_STORE, Resilience4jConfig.breakerConfig(props)),
                Retry.of(Resilience4jConfig.VECTOR_STORE, Resilience4jConfig.retryConfig(props)),
                TimeLimiter.of(Resilience4jConfig.timeLimiterConfig(props)),
                executor,
                Clock.fixed(OPENED, ZoneOffset.UTC));
    }

    enum Behaviour { HANG, FAIL, FAIL_TWICE_THEN_OK, OK, SLOW_OK, EMPTY }

    static final class FakeStore implements VectorStoreClient {

        final AtomicInteger calls = new AtomicInteger();
        volatile Behaviour  behaviour = Behaviour.OK;

        @Override
        public List<StoreHit> search(float[] vector, int topK) {
            int n = calls.incrementAndGet();
            switch (behaviour) {
                case HANG -> {
                    sleep(10_000);
                    return List.of();
                }
                case FAIL -> throw new StoreException("connection refused");
                case FAIL_TWICE_THEN_OK -> {
                    if (n <= 2) throw new StoreException("connection reset");
                    return hits();
                }
                case SLOW_OK -> {
                    sleep(400);
                    return hits();
                }
                case EMPTY -> {
                    return List.of();
                }
                default -> {
                    return hits();
                }
            }
        }

        private static List<StoreHit> hits() {
            return List.of(new StoreHit("m1", 0.9, Map.of("content", "hello"), new float[]{1f, 0f}));
        }

        private static void sleep(long ms) {
            try {
                Thread.sleep(ms);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StoreException("interrupted", e);
            }
        }
    }
}
