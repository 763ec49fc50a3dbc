package com.openforge.recall.config;

import com.openforge.recall.store.StoreCallCancelledException;
import com.openforge.recall.store.StoreProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Programmatic Resilience4j wiring for the "vectorStore" instance, built from
 * {@link StoreProperties}.
 *
 * Decoration order at the call site, outermost first:
 *   CircuitBreaker → Retry → TimeLimiter → store call
 * so the breaker sees one logical call per query, however many attempts it took.
 */
@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class Resilience4jConfig {

    public static final String VECTOR_STORE = "vectorStore";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(StoreProperties props) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(breakerConfig(props));
        registry.circuitBreaker(VECTOR_STORE);
        return registry;
    }

    @Bean
    public CircuitBreaker vectorStoreCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(VECTOR_STORE);
    }

    /**
     * Opens after {@code failureLimit} consecutive failed calls: a count window of
     * exactly that size, evaluated only when full, tripping at 100 % failures.
     * One trial call in HALF_OPEN; its outcome alone closes or reopens.
     */
    public static CircuitBreakerConfig breakerConfig(StoreProperties props) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(props.failureLimit())
                .minimumNumberOfCalls(props.failureLimit())
                .failureRateThreshold(100)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(props.openDuration())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                // an interrupted query says nothing about store health
                .ignoreExceptions(StoreCallCancelledException.class)
                .build();
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry(StoreProperties props) {
        RetryRegistry registry = RetryRegistry.of(retryConfig(props));
        registry.retry(VECTOR_STORE);
        return registry;
    }

    @Bean
    public Retry vectorStoreRetry(RetryRegistry registry) {
        return registry.retry(VECTOR_STORE);
    }

    /** maxRetries + 1 attempts, spaced by {@link #backoff}. */
    public static RetryConfig retryConfig(StoreProperties props) {
        return RetryConfig.custom()
                .maxAttempts(props.maxAttempts())
                .intervalFunction(backoff(props))
                .ignoreExceptions(StoreCallCancelledException.class, CallNotPermittedException.class)
                .build();
    }

    /** Attempt n waits {@code base * 2^(n-1)} plus up to jitterRatio of that. */
    public static IntervalFunction backoff(StoreProperties props) {
        long   baseMs = props.backoffBase().toMillis();
        double jitter = props.jitterRatio();
        return attempt -> {
            long wait = baseMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
            return wait + (long) (wait * jitter * ThreadLocalRandom.current().nextDouble());
        };
    }

    // ── Time Limiter ─────────────────────────────────────────────────────────

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(StoreProperties props) {
        TimeLimiterRegistry registry = TimeLimiterRegistry.of(timeLimiterConfig(props));
        registry.timeLimiter(VECTOR_STORE);
        return registry;
    }

    @Bean
    public TimeLimiter vectorStoreTimeLimiter(TimeLimiterRegistry registry) {
        return registry.timeLimiter(VECTOR_STORE);
    }

    public static TimeLimiterConfig timeLimiterConfig(StoreProperties props) {
        return TimeLimiterConfig.custom()
                .timeoutDuration(props.timeout())
                .cancelRunningFuture(true)
                .build();
    }
}
