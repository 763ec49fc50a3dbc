package com.openforge.recall.arbitration;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide current {@link ArbitrationProfile}. Queries read a snapshot;
 * only {@link ArbitrationLearner} swaps in a new one.
 */
@Component
public class ArbitrationProfileHolder {

    private final AtomicReference<ArbitrationProfile> current;

    @Autowired
    public ArbitrationProfileHolder(ArbitrationProfileStore store) {
        this(store.load());
    }

    ArbitrationProfileHolder(ArbitrationProfile initial) {
        this.current = new AtomicReference<>(initial);
    }

    public ArbitrationProfile current() {
        return current.get();
    }

    void swap(ArbitrationProfile next) {
        current.set(next);
    }
}
