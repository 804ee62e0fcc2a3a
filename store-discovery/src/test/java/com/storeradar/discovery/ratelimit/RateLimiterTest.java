package com.storeradar.discovery.ratelimit;

import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.config.RunSettings;
import com.storeradar.discovery.error.FetchCancelledException;
import com.storeradar.discovery.error.SourceBackoffException;
import com.storeradar.discovery.model.AdapterState;
import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.run.RunContext;
import com.storeradar.discovery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private MutableClock clock;
    private List<Duration> sleeps;
    private Sleeper sleeper;
    private boolean cancelDuringSleep;
    private AdapterState state;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T00:00:00Z");
        sleeps = new ArrayList<>();
        sleeper = (d, signal) -> {
            sleeps.add(d);
            clock.advance(d);
            return cancelDuringSleep;
        };
        state = new AdapterState("test-source");
    }

    private RateLimiter limiter(int quota, Duration window) {
        RateLimitPolicy policy = new RateLimitPolicy(Duration.ofSeconds(1), Duration.ofMinutes(1),
                Duration.ofMinutes(4), 3, quota, window);
        return new RateLimiter(state, policy, clock, sleeper);
    }

    @Test
    @DisplayName("waits out the minimum delay between requests")
    void enforcesMinimumDelay() throws InterruptedException {
        RateLimiter limiter = limiter(0, Duration.ZERO);

        limiter.acquire(CancellationSignal.NEVER);
        clock.advance(Duration.ofMillis(300));
        limiter.acquire(CancellationSignal.NEVER);
        clock.advance(Duration.ofSeconds(2));
        limiter.acquire(CancellationSignal.NEVER);

        assertThat(sleeps).containsExactly(Duration.ofMillis(700));
    }

    @Test
    @DisplayName("backoff doubles per throttle and stops at the ceiling")
    void exponentialBackoff() {
        RateLimiter limiter = limiter(0, Duration.ZERO);

        limiter.onThrottle();
        assertThat(limiter.currentBackoff()).isEqualTo(Duration.ofMinutes(1));
        limiter.onThrottle();
        assertThat(limiter.currentBackoff()).isEqualTo(Duration.ofMinutes(2));
        limiter.onThrottle();
        limiter.onThrottle();
        assertThat(limiter.currentBackoff()).isEqualTo(Duration.ofMinutes(4));

        assertThat(limiter.isBackingOff()).isTrue();
        clock.advance(Duration.ofMinutes(4).plusSeconds(1));
        assertThat(limiter.isBackingOff()).isFalse();
    }

    @Test
    @DisplayName("a streak of clean responses resets the backoff")
    void successStreakResets() {
        RateLimiter limiter = limiter(0, Duration.ZERO);
        limiter.onThrottle();
        limiter.onThrottle();

        limiter.onSuccess();
        limiter.onSuccess();
        assertThat(limiter.currentBackoff()).isEqualTo(Duration.ofMinutes(2));

        limiter.onSuccess();
        assertThat(limiter.currentBackoff()).isZero();

        limiter.onThrottle();
        assertThat(limiter.currentBackoff()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void throttleInterruptsStreak() {
        RateLimiter limiter = limiter(0, Duration.ZERO);
        limiter.onThrottle();
        limiter.onSuccess();
        limiter.onSuccess();
        limiter.onThrottle();
        limiter.onSuccess();

        assertThat(limiter.currentBackoff()).isEqualTo(Duration.ofMinutes(2));
        assertThat(state.getSuccessStreak()).isEqualTo(1);
    }

    @Test
    @DisplayName("using up the window quota backs off until the window ends")
    void quotaWindow() throws InterruptedException {
        RateLimiter limiter = limiter(2, Duration.ofHours(1));

        limiter.acquire(CancellationSignal.NEVER);
        assertThat(limiter.isBackingOff()).isFalse();
        clock.advance(Duration.ofSeconds(5));
        limiter.acquire(CancellationSignal.NEVER);

        assertThat(limiter.isBackingOff()).isTrue();
        assertThat(limiter.backoffUntil()).isEqualTo(Instant.parse("2024-05-01T01:00:00Z"));

        clock.advance(Duration.ofHours(1));
        assertThat(limiter.isBackingOff()).isFalse();
        limiter.acquire(CancellationSignal.NEVER);
        assertThat(state.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("no request is booked while the source is backing off")
    void refusesWhileBackingOff() throws InterruptedException {
        RateLimiter limiter = limiter(2, Duration.ofHours(1));
        limiter.acquire(CancellationSignal.NEVER);
        limiter.acquire(CancellationSignal.NEVER);

        assertThatThrownBy(() -> limiter.acquire(CancellationSignal.NEVER))
                .isInstanceOf(SourceBackoffException.class)
                .satisfies(e -> assertThat(((SourceBackoffException) e).getBackoffUntil())
                        .isEqualTo(Instant.parse("2024-05-01T01:00:00Z")));

        assertThat(state.getRequestCount()).isEqualTo(2);
        assertThat(limiter.currentBackoff()).isZero();
    }

    @Test
    @DisplayName("a cancel during the pacing wait stops the request from going out")
    void cancelledDuringWait() throws InterruptedException {
        RateLimiter limiter = limiter(0, Duration.ZERO);
        limiter.acquire(CancellationSignal.NEVER);
        Instant booked = state.getLastRequestAt();
        cancelDuringSleep = true;

        assertThatThrownBy(() -> limiter.acquire(CancellationSignal.NEVER))
                .isInstanceOf(FetchCancelledException.class);

        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
        assertThat(state.getLastRequestAt()).isEqualTo(booked);
    }

    @Test
    void alreadyCancelledSignalIsRefused() {
        RateLimiter limiter = limiter(0, Duration.ZERO);
        CancellationSignal cancelled = new CancellationSignal() {
            @Override
            public boolean isCancelled() {
                return true;
            }

            @Override
            public boolean await(Duration timeout) {
                return true;
            }
        };

        assertThatThrownBy(() -> limiter.acquire(cancelled))
                .isInstanceOf(FetchCancelledException.class);
        assertThat(state.getLastRequestAt()).isNull();
    }

    @Test
    @DisplayName("the production sleeper wakes as soon as the run is cancelled")
    void untilCancelledSleeperWakesOnCancel() throws InterruptedException {
        RunContext run = new RunContext("run-1", RunSettings.snapshot(new DiscoveryProperties(), Cadence.FAST),
                Instant.parse("2024-05-01T00:00:00Z"));
        run.cancel();

        long started = System.nanoTime();
        assertThat(Sleeper.untilCancelled().sleep(Duration.ofHours(1), run)).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));

        assertThat(Sleeper.untilCancelled().sleep(Duration.ZERO, CancellationSignal.NEVER)).isFalse();
    }
}
