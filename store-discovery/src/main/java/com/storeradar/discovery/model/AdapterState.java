package com.storeradar.discovery.model;

import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable per-adapter bookkeeping. Owned by one adapter and its rate limiter; lives for
 * the process lifetime so the cursor and backoff carry over between runs.
 */
@Data
public class AdapterState {

    private final String sourceName;
    private Instant windowStart;
    private int requestCount;
    private Instant backoffUntil;
    private Duration backoffDelay = Duration.ZERO;
    private int successStreak;
    private Instant lastRequestAt;
    private String cursor;                  // null = start from the beginning
}
