package com.storeradar.discovery.model;

import java.util.Locale;

/**
 * How often and how broadly a run searches.
 * Breadth decides which of two coalesced triggers survives.
 */
public enum Cadence {
    FAST(1),
    DEEP(2),
    COMPREHENSIVE(3),
    MANUAL(3);

    private final int breadth;

    Cadence(int breadth) {
        this.breadth = breadth;
    }

    public int breadth() {
        return breadth;
    }

    /**
     * The broader of the two; the already queued one wins a tie.
     */
    public static Cadence broadest(Cadence queued, Cadence incoming) {
        if (queued == null) return incoming;
        if (incoming == null) return queued;
        return incoming.breadth > queued.breadth ? incoming : queued;
    }

    public static Cadence parse(String value) {
        if (value == null || value.isBlank()) return MANUAL;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("cadence must be one of FAST, DEEP, COMPREHENSIVE, MANUAL");
        }
    }
}
