package com.openforge.recall.store;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the store circuit breaker.
 *
 * @param state                closed, open or half-open
 * @param consecutiveFailures  failed logical calls since the last success
 * @param openedAt             when the breaker last opened; null if it never has
 * @param failureLimit         consecutive failures that open the breaker
 * @param openDuration         how long it stays open before admitting a trial call
 */
public record BreakerSnapshot(
        State    state,
        int      consecutiveFailures,
        @Nullable Instant openedAt,
        int      failureLimit,
        Duration openDuration
) {

    public enum State { CLOSED, OPEN, HALF_OPEN }

    public boolean isOpen() {
        return state == State.OPEN;
    }
}
