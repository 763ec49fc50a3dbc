package com.openforge.recall.store;

/** How a logical store fetch ended. */
public enum FetchOutcome {
    /** Store answered with at least one hit. */
    OK,
    /** Store answered with no hits. Healthy, just nothing there. */
    EMPTY,
    /** Rejected by the open circuit breaker; the store was not called. */
    CIRCUIT_OPEN,
    /** Every attempt timed out. */
    TIMEOUT,
    /** Attempts failed with a store error (the last one counts). */
    STORE_ERROR,
    /** The calling thread was interrupted; no further attempts were made. */
    CANCELLED;

    /** True when the outcome counts against the circuit breaker. */
    public boolean isFailure() {
        return this == TIMEOUT || this == STORE_ERROR;
    }
}
