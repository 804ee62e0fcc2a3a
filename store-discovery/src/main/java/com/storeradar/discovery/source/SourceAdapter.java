package com.storeradar.discovery.source;

import com.storeradar.discovery.model.AdapterState;
import com.storeradar.discovery.model.PriorityTier;
import com.storeradar.discovery.ratelimit.CancellationSignal;
import com.storeradar.discovery.ratelimit.RateLimiter;

/**
 * An external feed of candidate storefront URLs.
 *
 * Implementations should not throw from {@link #fetch}: malformed records are skipped
 * and counted, transport failures, throttling and cancellation come back as flags on the
 * result. The run still guards each adapter in case one does.
 */
public interface SourceAdapter {

    String name();

    PriorityTier tier();

    /**
     * False when required credentials are missing; the run skips the adapter.
     */
    boolean isConfigured();

    /**
     * One page from {@code cursor}. Pacing waits end early once {@code cancellation} fires.
     */
    FetchResult fetch(String cursor, CancellationSignal cancellation);

    default FetchResult fetch(String cursor) {
        return fetch(cursor, CancellationSignal.NEVER);
    }

    AdapterState state();

    RateLimiter rateLimiter();

    int maxPagesPerRun();
}
