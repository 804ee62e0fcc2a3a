package com.storeradar.discovery.store;

import com.storeradar.discovery.config.RunSettings;

import java.time.Duration;
import java.time.Instant;

/**
 * Linear backoff with a ceiling: attempt n waits {@code min(base * n, ceiling)}.
 */
public class RetryPolicy {

    private final Duration base;
    private final Duration ceiling;
    private final int maxRetries;

    public RetryPolicy(Duration base, Duration ceiling, int maxRetries) {
        this.base = base;
        this.ceiling = ceiling;
        this.maxRetries = maxRetries;
    }

    public static RetryPolicy from(RunSettings settings) {
        return new RetryPolicy(settings.getRetryBase(), settings.getRetryCeiling(), settings.getMaxRetries());
    }

    public Duration delayFor(int retryCount) {
        Duration delay = base.multipliedBy(Math.max(1, retryCount));
        return delay.compareTo(ceiling) > 0 ? ceiling : delay;
    }

    public Instant nextRetryAt(Instant now, int retryCount) {
        return now.plus(delayFor(retryCount));
    }

    /**
     * True once a create-mode candidate has used up its retries and should be dropped.
     */
    public boolean isExhausted(int retryCount) {
        return retryCount > maxRetries;
    }
}
