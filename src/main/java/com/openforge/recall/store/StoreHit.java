package com.openforge.recall.store;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * A raw hit as returned by the vector store, before normalization.
 *
 * @param id          store identifier
 * @param similarity  store-reported similarity (may be out of range; clamped later)
 * @param payload     loosely typed stored fields
 * @param embedding   stored vector when the store returns it, otherwise null
 */
public record StoreHit(
        String              id,
        double              similarity,
        Map<String, Object> payload,
        @Nullable float[]   embedding
) {
    public StoreHit {
        payload = payload == null ? Map.of() : payload;
    }
}
