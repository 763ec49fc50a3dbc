package com.openforge.recall.store;

import com.openforge.recall.candidate.Candidate;
import com.openforge.recall.candidate.CandidateNormalizer;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The only path from the recall core to the vector store.
 *
 * Call graph for one query:
 *
 *   fetchWithOutcome(vector, topK)
 *     └─ vectorStore CircuitBreaker       (one logical call)
 *          └─ vectorStore Retry           (up to maxRetries + 1 attempts, sleeping backoff)
 *               └─ vectorStore TimeLimiter (per attempt)
 *                    └─ storeExecutor → VectorStoreClient.search
 *
 * Never throws: every failure comes back as an empty {@link StoreFetch} with a
 * {@link FetchOutcome} saying why. Attempts within one query are sequential.
 */
@Slf4j
@Component
public class ResilientStoreAccess {

    private final VectorStoreClient   client;
    private final CandidateNormalizer normalizer;
    private final StoreProperties     props;
    private final CircuitBreaker      breaker;
    private final Retry               retry;
    private final TimeLimiter         timeLimiter;
    private final ExecutorService     storeExecutor;
    private final Clock               clock;

    private final AtomicInteger           consecutiveFailures = new AtomicInteger();
    private final AtomicReference<Instant> openedAt           = new AtomicReference<>();

    public ResilientStoreAccess(VectorStoreClient client,
                                CandidateNormalizer normalizer,
                                StoreProperties props,
                                CircuitBreaker vectorStoreCircuitBreaker,
                                Retry vectorStoreRetry,
                                TimeLimiter vectorStoreTimeLimiter,
                                @Qualifier("storeExecutor") ExecutorService storeExecutor,
                                Clock clock) {
        this.client        = client;
        this.normalizer    = normalizer;
        this.props         = props;
        this.breaker       = vectorStoreCircuitBreaker;
        this.retry         = vectorStoreRetry;
        this.timeLimiter   = vectorStoreTimeLimiter;
        this.storeExecutor = storeExecutor;
        this.clock         = clock;

        breaker.getEventPublisher().onStateTransition(e -> {
            CircuitBreaker.State to = e.getStateTransition().getToState();
            if (to == CircuitBreaker.State.OPEN) {
                openedAt.set(clock.instant());
                log.warn("[Breaker] {} {} → OPEN, rejecting calls for {}",
                        e.getCircuitBreakerName(), e.getStateTransition().getFromState(), props.openDuration());
            } else {
                log.info("[Breaker] {} {} → {}", e.getCircuitBreakerName(),
                        e.getStateTransition().getFromState(), to);
            }
        });
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** Candidates for the query vector; empty on any failure. */
    public List<Candidate> fetch(float[] queryVector, int topK) {
        return fetchWithOutcome(queryVector, topK).candidates();
    }

    public StoreFetch fetchWithOutcome(@Nullable float[] queryVector, int topK) {
        if (queryVector == null || queryVector.length == 0 || topK <= 0) {
            return StoreFetch.failed(FetchOutcome.EMPTY, 0);
        }

        AtomicInteger attempts = new AtomicInteger();
        Callable<List<StoreHit>> attempt = () -> {
            if (Thread.currentThread().isInterrupted()) {
                throw new StoreCallCancelledException("Query cancelled before attempt " + (attempts.get() + 1));
            }
            attempts.incrementAndGet();
            try {
                return timeLimiter.executeFutureSupplier(
                        () -> storeExecutor.submit(() -> client.search(queryVector, topK)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StoreCallCancelledException("Query cancelled while waiting on the store", e);
            }
        };
        Callable<List<StoreHit>> decorated =
                CircuitBreaker.decorateCallable(breaker,
                        Retry.decorateCallable(retry, attempt));

        try {
            List<StoreHit> hits = decorated.call();
            consecutiveFailures.set(0);
            List<Candidate> candidates = normalizer.normalizeAll(hits == null ? List.of() : hits);
            FetchOutcome outcome = candidates.isEmpty() ? FetchOutcome.EMPTY : FetchOutcome.OK;
            log.debug("[Store] {} hit(s) in {} attempt(s)", candidates.size(), attempts.get());
            return new StoreFetch(candidates, outcome, attempts.get());

        } catch (CallNotPermittedException e) {
            log.warn("[Breaker] Circuit open: store not called, returning no candidates");
            return StoreFetch.failed(FetchOutcome.CIRCUIT_OPEN, 0);

        } catch (StoreCallCancelledException e) {
            log.info("[Store] {} after {} attempt(s)", e.getMessage(), attempts.get());
            return StoreFetch.failed(FetchOutcome.CANCELLED, attempts.get());

        } catch (TimeoutException e) {
            int n = consecutiveFailures.incrementAndGet();
            log.warn("[Store] Timed out after {} attempt(s) ({} consecutive failed queries)", attempts.get(), n);
            return StoreFetch.failed(FetchOutcome.TIMEOUT, attempts.get());

        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("[Store] Query cancelled during backoff after {} attempt(s)", attempts.get());
                return StoreFetch.failed(FetchOutcome.CANCELLED, attempts.get());
            }
            int n = consecutiveFailures.incrementAndGet();
            log.warn("[Store] Search failed after {} attempt(s) ({} consecutive failed queries): {}",
                    attempts.get(), n, e.getMessage());
            return StoreFetch.failed(FetchOutcome.STORE_ERROR, attempts.get());
        }
    }

    // ── Breaker state ────────────────────────────────────────────────────────

    public boolean isOpen() {
        return breaker.getState() == CircuitBreaker.State.OPEN;
    }

    public BreakerSnapshot breakerSnapshot() {
        BreakerSnapshot.State state = switch (breaker.getState()) {
            case OPEN, FORCED_OPEN -> BreakerSnapshot.State.OPEN;
            case HALF_OPEN         -> BreakerSnapshot.State.HALF_OPEN;
            default                -> BreakerSnapshot.State.CLOSED;
        };
        return new BreakerSnapshot(
                state,
                consecutiveFailures.get(),
                openedAt.get(),
                props.failureLimit(),
                props.openDuration());
    }
}
