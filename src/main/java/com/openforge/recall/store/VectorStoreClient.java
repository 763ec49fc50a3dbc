package com.openforge.recall.store;

import java.util.List;

/**
 * Nearest-neighbour search over stored memories.
 *
 * Implementations may throw anything; {@link ResilientStoreAccess} treats
 * every exception as a failed attempt.
 */
public interface VectorStoreClient {

    List<StoreHit> search(float[] vector, int topK);

    // ── Exception ────────────────────────────────────────────────────────────

    class StoreException extends RuntimeException {
        public StoreException(String message) { super(message); }
        public StoreException(String message, Throwable cause) { super(message, cause); }
    }
}
