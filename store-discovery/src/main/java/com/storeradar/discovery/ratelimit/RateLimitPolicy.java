package com.storeradar.discovery.ratelimit;

import java.time.Duration;

/**
 * Limits for one source.
 *
 * @param minDelay              minimum gap between two requests
 * @param initialBackoff        first backoff after a throttle response
 * @param maxBackoff            ceiling for the doubling backoff
 * @param successStreakToReset  clean responses needed before the backoff resets
 * @param maxRequestsPerWindow  request quota per window, 0 = no quota
 * @param window                quota window length
 */
public record RateLimitPolicy(Duration minDelay,
                              Duration initialBackoff,
                              Duration maxBackoff,
                              int successStreakToReset,
                              int maxRequestsPerWindow,
                              Duration window) {

    public boolean hasQuota() {
        return maxRequestsPerWindow > 0 && window != null && !window.isZero();
    }
}
