package com.openforge.recall.store;

/**
 * The querying thread was interrupted. Neither retried nor recorded by the
 * circuit breaker.
 */
public class StoreCallCancelledException extends RuntimeException {

    public StoreCallCancelledException(String message) {
        super(message);
    }

    public StoreCallCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
