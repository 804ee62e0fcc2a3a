package com.storeradar.discovery.ratelimit;

import com.storeradar.discovery.error.FetchCancelledException;
import com.storeradar.discovery.error.SourceBackoffException;
import com.storeradar.discovery.model.AdapterState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-source pacing and backoff.
 *
 * Single owner: each adapter has its own limiter and calls it from the run thread only,
 * so there is no locking here.
 */
@Slf4j
public class RateLimiter {

    private final AdapterState state;
    private final RateLimitPolicy policy;
    private final Clock clock;
    private final Sleeper sleeper;

    public RateLimiter(AdapterState state, RateLimitPolicy policy, Clock clock, Sleeper sleeper) {
        this.state = state;
        this.policy = policy;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the next request may go out and books it against the quota window.
     *
     * @throws SourceBackoffException the source is backing off; nothing may be sent yet
     * @throws FetchCancelledException the run was cancelled before or during the wait
     */
    public void acquire(CancellationSignal signal) throws InterruptedException {
        if (signal.isCancelled()) {
            throw new FetchCancelledException(state.getSourceName());
        }
        if (isBackingOff()) {
            throw new SourceBackoffException(state.getSourceName(), state.getBackoffUntil());
        }

        Instant lastRequest = state.getLastRequestAt();
        if (lastRequest != null) {
            Duration wait = policy.minDelay().minus(Duration.between(lastRequest, clock.instant()));
            if (!wait.isNegative() && !wait.isZero() && sleeper.sleep(wait, signal)) {
                throw new FetchCancelledException(state.getSourceName());
            }
        }

        Instant now = clock.instant();
        state.setLastRequestAt(now);

        if (policy.hasQuota()) {
            Instant windowStart = state.getWindowStart();
            if (windowStart == null || !now.isBefore(windowStart.plus(policy.window()))) {
                state.setWindowStart(now);
                state.setRequestCount(0);
            }
            state.setRequestCount(state.getRequestCount() + 1);
            if (state.getRequestCount() >= policy.maxRequestsPerWindow()) {
                Instant windowEnd = state.getWindowStart().plus(policy.window());
                extendBackoff(windowEnd);
                log.info("[{}] request quota of {} used up, pausing until {}",
                        state.getSourceName(), policy.maxRequestsPerWindow(), windowEnd);
            }
        }
    }

    /**
     * Upstream said slow down (429, or a 503/403 quota response). Doubles the backoff.
     */
    public void onThrottle() {
        Duration current = state.getBackoffDelay();
        Duration next = current == null || current.isZero()
                ? policy.initialBackoff()
                : min(current.multipliedBy(2), policy.maxBackoff());
        state.setBackoffDelay(next);
        state.setSuccessStreak(0);
        extendBackoff(clock.instant().plus(next));
        log.warn("[{}] throttled, backing off for {} (until {})",
                state.getSourceName(), next, state.getBackoffUntil());
    }

    public void onSuccess() {
        Duration current = state.getBackoffDelay();
        if (current == null || current.isZero()) return;

        state.setSuccessStreak(state.getSuccessStreak() + 1);
        if (state.getSuccessStreak() >= policy.successStreakToReset()) {
            log.info("[{}] {} clean responses, backoff reset", state.getSourceName(), state.getSuccessStreak());
            state.setBackoffDelay(Duration.ZERO);
            state.setSuccessStreak(0);
        }
    }

    public boolean isBackingOff() {
        Instant until = state.getBackoffUntil();
        return until != null && clock.instant().isBefore(until);
    }

    public Instant backoffUntil() {
        return state.getBackoffUntil();
    }

    public Duration currentBackoff() {
        return state.getBackoffDelay();
    }

    private void extendBackoff(Instant until) {
        Instant existing = state.getBackoffUntil();
        if (existing == null || until.isAfter(existing)) {
            state.setBackoffUntil(until);
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
