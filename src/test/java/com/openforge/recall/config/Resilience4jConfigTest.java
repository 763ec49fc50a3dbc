package com.openforge.recall.config;

import com.openforge.recall.store.StoreCallCancelledException;
import com.openforge.recall.store.StoreProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class Resilience4jConfigTest {

    private final StoreProperties props = new StoreProperties(Duration.ofSeconds(1), 2, Duration.ofMillis(200),
            0.25, 3, Duration.ofSeconds(20), 4);

    @RepeatedTest(50)
    void backoffDoublesPerAttemptWithBoundedJitter() {
        IntervalFunction backoff = Resilience4jConfig.backoff(props);

        for (int n = 1; n <= 3; n++) {
            long expected = 200L * (1L << (n - 1));
            assertThat(backoff.apply(n)).isBetween(expected, (long) (expected * 1.25));
        }
    }

    @Test
    void zeroJitterGivesTheExactSchedule() {
        StoreProperties noJitter = new StoreProperties(Duration.ofSeconds(1), 2, Duration.ofMillis(50),
                0.0, 3, Duration.ofSeconds(20), 4);
        IntervalFunction backoff = Resilience4jConfig.backoff(noJitter);

        assertThat(backoff.apply(1)).isEqualTo(50L);
        assertThat(backoff.apply(2)).isEqualTo(100L);
        assertThat(backoff.apply(3)).isEqualTo(200L);
    }

    @Test
    void retryAllowsMaxRetriesPlusOneAttempts() {
        RetryConfig config = Resilience4jConfig.retryConfig(props);

        assertThat(config.getMaxAttempts()).isEqualTo(3);
        assertThat(config.getExceptionPredicate().test(new StoreCallCancelledException("interrupted"))).isFalse();
        assertThat(config.getExceptionPredicate().test(new IllegalStateException("boom"))).isTrue();
    }

    @Test
    void breakerTripsOnlyOnAFullWindowOfFailures() {
        CircuitBreakerConfig config = Resilience4jConfig.breakerConfig(props);

        assertThat(config.getSlidingWindowSize()).isEqualTo(3);
        assertThat(config.getMinimumNumberOfCalls()).isEqualTo(3);
        assertThat(config.getFailureRateThreshold()).isEqualTo(100f);
        assertThat(config.getPermittedNumberOfCallsInHalfOpenState()).isEqualTo(1);
    }
}
