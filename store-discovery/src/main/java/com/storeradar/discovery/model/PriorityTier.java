package com.storeradar.discovery.model;

/**
 * Cost tier of a source. Adapters run cheapest first; a cadence includes every tier
 * up to its ceiling.
 */
public enum PriorityTier {
    FREE_FAST,
    FREE_SLOW,
    QUOTA_LIMITED,
    EXPENSIVE;

    public boolean isWithin(PriorityTier ceiling) {
        return ordinal() <= ceiling.ordinal();
    }
}
