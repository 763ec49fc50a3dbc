package com.openforge.recall.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sanitizes configuration values: a bad value falls back to its built-in
 * default, and the fallback is logged once per key for the life of the process.
 */
@Slf4j
public final class ConfigWarnings {

    private static final Set<String> WARNED = ConcurrentHashMap.newKeySet();

    private ConfigWarnings() {}

    public static void warnOnce(String key, Object badValue, Object fallback) {
        if (WARNED.add(key)) {
            log.warn("[Config] Invalid value '{}' for {}, using default {}", badValue, key, fallback);
        }
    }

    /** Non-negative finite value, else {@code dflt}. */
    public static double nonNegative(String key, double value, double dflt) {
        if (!Double.isFinite(value) || value < 0) {
            warnOnce(key, value, dflt);
            return dflt;
        }
        return value;
    }

    /** Finite value within [lo, hi], else {@code dflt}. */
    public static double inRange(String key, double value, double lo, double hi, double dflt) {
        if (!Double.isFinite(value) || value < lo || value > hi) {
            warnOnce(key, value, dflt);
            return dflt;
        }
        return value;
    }

    public static int atLeast(String key, int value, int min, int dflt) {
        if (value < min) {
            warnOnce(key, value, dflt);
            return dflt;
        }
        return value;
    }

    /** Parses a number from configuration text, falling back on blank or garbage. */
    public static double parse(String key, String raw, double dflt) {
        if (raw == null || raw.isBlank()) return dflt;
        try {
            return Double.parseDouble(raw.strip());
        } catch (NumberFormatException e) {
            warnOnce(key, raw, dflt);
            return dflt;
        }
    }

    static void resetForTests() {
        WARNED.clear();
    }
}
