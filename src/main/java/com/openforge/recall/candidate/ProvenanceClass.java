package com.openforge.recall.candidate;

/**
 * Where a stored item came from, as far as arbitration is concerned.
 *
 * BASE        : plain stored memories and facts.
 * EPISODIC    : "what happened": events, actions, observed results.
 * PROCEDURAL  : "how to do it": reusable steps and workflows.
 * ABSTRACTION : "why": consolidated generalizations over many items.
 *
 * The JSON sidecar of the arbitration profile uses {@link #key()} as field names.
 */
public enum ProvenanceClass {
    BASE,
    EPISODIC,
    PROCEDURAL,
    ABSTRACTION;

    public String key() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
