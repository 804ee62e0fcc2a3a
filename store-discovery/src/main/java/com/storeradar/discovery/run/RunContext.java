package com.storeradar.discovery.run;

import com.storeradar.discovery.config.RunSettings;
import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.ratelimit.CancellationSignal;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything that belongs to one run: frozen settings, the seen-set, counters,
 * in-flight validations and the cancellation flag.
 */
@Getter
public class RunContext implements CancellationSignal {

    private final String runId;
    private final RunSettings settings;
    private final Instant startedAt;
    private final RunReporter reporter;
    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    @Getter(AccessLevel.NONE)
    private final AtomicInteger submitted = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final CountDownLatch cancelled = new CountDownLatch(1);
    @Getter(AccessLevel.NONE)
    private final List<CompletableFuture<Void>> inFlight = new ArrayList<>();   // run thread only

    public RunContext(String runId, RunSettings settings, Instant startedAt) {
        this.runId = runId;
        this.settings = settings;
        this.startedAt = startedAt;
        this.reporter = new RunReporter(runId, settings.getCadence(), startedAt);
    }

    public Cadence getCadence() {
        return settings.getCadence();
    }

    public void cancel() {
        cancelled.countDown();
    }

    @Override
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) return isCancelled();
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Pause for {@code delay} unless the run is cancelled first.
     *
     * @return true if the run was cancelled
     */
    public boolean awaitCancellation(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) return isCancelled();
        try {
            return await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }

    void track(CompletableFuture<Void> validation) {
        submitted.incrementAndGet();
        inFlight.add(validation);
    }

    List<CompletableFuture<Void>> inFlight() {
        return inFlight;
    }

    public int submittedCount() {
        return submitted.get();
    }

    public boolean isQuotaReached() {
        return settings.hasQuota() && submitted.get() >= settings.getCandidateQuota();
    }
}
