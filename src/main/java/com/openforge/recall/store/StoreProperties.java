package com.openforge.recall.store;

import com.openforge.recall.config.ConfigWarnings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Resilience policy for vector store calls.
 *
 * application.yml:
 *
 * recall:
 *   store:
 *     timeout: 8s
 *     max-retries: 2          # 3 attempts in total
 *     backoff-base: 200ms     # attempt n waits base * 2^(n-1), plus jitter
 *     jitter-ratio: 0.25
 *     failure-limit: 3        # consecutive failed queries before the breaker opens
 *     open-duration: 20s
 *     executor-threads: 8
 */
@ConfigurationProperties(prefix = "recall.store")
public record StoreProperties(
        @DefaultValue("8s")    Duration timeout,
        @DefaultValue("2")     int      maxRetries,
        @DefaultValue("200ms") Duration backoffBase,
        @DefaultValue("0.25")  double   jitterRatio,
        @DefaultValue("3")     int      failureLimit,
        @DefaultValue("20s")   Duration openDuration,
        @DefaultValue("8")     int      executorThreads
) {

    public StoreProperties {
        timeout         = positive("recall.store.timeout", timeout, Duration.ofSeconds(8));
        maxRetries      = ConfigWarnings.atLeast("recall.store.max-retries", maxRetries, 0, 2);
        backoffBase     = backoffBase == null || backoffBase.isNegative() ? Duration.ofMillis(200) : backoffBase;
        jitterRatio     = ConfigWarnings.inRange("recall.store.jitter-ratio", jitterRatio, 0.0, 1.0, 0.25);
        failureLimit    = ConfigWarnings.atLeast("recall.store.failure-limit", failureLimit, 1, 3);
        openDuration    = positive("recall.store.open-duration", openDuration, Duration.ofSeconds(20));
        executorThreads = ConfigWarnings.atLeast("recall.store.executor-threads", executorThreads, 1, 8);
    }

    public static StoreProperties defaults() {
        return new StoreProperties(Duration.ofSeconds(8), 2, Duration.ofMillis(200), 0.25, 3,
                Duration.ofSeconds(20), 8);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    private static Duration positive(String key, Duration value, Duration dflt) {
        if (value == null || value.isZero() || value.isNegative()) {
            ConfigWarnings.warnOnce(key, value, dflt);
            return dflt;
        }
        return value;
    }
}
