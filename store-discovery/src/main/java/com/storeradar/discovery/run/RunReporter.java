package com.storeradar.discovery.run;

import com.storeradar.discovery.dedup.DedupResult;
import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.model.RejectionStage;
import com.storeradar.discovery.model.RunOutcome;
import com.storeradar.discovery.model.RunReport;
import com.storeradar.discovery.model.SourceCounts;
import com.storeradar.discovery.source.FetchResult;
import com.storeradar.discovery.store.UpsertResult;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for one run. Written by the run thread and the validation workers at the
 * same time, so everything is a LongAdder; {@link #finish} freezes them into a report.
 */
public class RunReporter {

    private final String runId;
    private final Cadence cadence;
    private final Instant startedAt;

    private final Map<String, SourceCounter> sources = new ConcurrentHashMap<>();
    private final Map<RejectionStage, LongAdder> rejections = new ConcurrentHashMap<>();
    private final LongAdder candidates = new LongAdder();
    private final LongAdder created = new LongAdder();
    private final LongAdder refreshed = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder deferred = new LongAdder();
    private final LongAdder duplicates = new LongAdder();
    private final LongAdder errors = new LongAdder();

    public RunReporter(String runId, Cadence cadence, Instant startedAt) {
        this.runId = runId;
        this.cadence = cadence;
        this.startedAt = startedAt;
    }

    // ── Fetch side ───────────────────────────────────────────────────────────

    public void pageFetched(String source, FetchResult result) {
        SourceCounter counter = source(source);
        counter.pages.increment();
        counter.fetched.add(result.getCandidates().size());
        counter.dataErrors.add(result.getDataErrors());
        candidates.add(result.getCandidates().size());
        errors.add(result.getDataErrors());
        if (result.isThrottled()) {
            counter.throttled = true;
        } else if (result.isFailed()) {
            counter.lastError = result.getError();
            errors.increment();
        }
    }

    public void seeded(String source, int count) {
        SourceCounter counter = source(source);
        counter.fetched.add(count);
        counter.unique.add(count);
        candidates.add(count);
    }

    public void deduplicated(String source, DedupResult result) {
        SourceCounter counter = source(source);
        counter.unique.add(result.getAccepted().size());
        counter.duplicates.add(result.duplicates());
        duplicates.add(result.duplicates());
        for (int i = 0; i < result.getInvalid(); i++) {
            rejected(RejectionStage.INVALID_URL);
        }
    }

    /**
     * The adapter threw instead of reporting a failed page.
     */
    public void sourceFailed(String source, String error) {
        source(source).lastError = error;
        errors.increment();
    }

    public void sourceSkipped(String source, String reason) {
        source(source).skippedReason = reason;
    }

    // ── Validation side ──────────────────────────────────────────────────────

    public void accepted(UpsertResult result) {
        if (result == UpsertResult.CREATED) {
            created.increment();
        } else {
            refreshed.increment();
        }
    }

    public void rejected(RejectionStage stage) {
        rejected.increment();
        rejections.computeIfAbsent(stage, s -> new LongAdder()).increment();
    }

    public void deferred() {
        deferred.increment();
    }

    public void error() {
        errors.increment();
    }

    public RunReport finish(RunOutcome outcome, Instant finishedAt, String failureMessage) {
        Map<String, SourceCounts> perSource = new LinkedHashMap<>();
        sources.forEach((name, c) -> perSource.put(name, c.freeze()));

        Map<RejectionStage, Long> byStage = new EnumMap<>(RejectionStage.class);
        rejections.forEach((stage, count) -> byStage.put(stage, count.sum()));

        return RunReport.builder()
                .runId(runId)
                .cadence(cadence)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .outcome(outcome)
                .perSourceCounts(Map.copyOf(perSource))
                .totalCandidates(candidates.sum())
                .totalNew(created.sum())
                .totalRefreshed(refreshed.sum())
                .totalRejected(rejected.sum())
                .totalDeferred(deferred.sum())
                .totalDuplicates(duplicates.sum())
                .totalErrors(errors.sum())
                .rejectionsByStage(Map.copyOf(byStage))
                .failureMessage(failureMessage)
                .build();
    }

    private SourceCounter source(String name) {
        return sources.computeIfAbsent(name, n -> new SourceCounter());
    }

    private static final class SourceCounter {
        final LongAdder pages = new LongAdder();
        final LongAdder fetched = new LongAdder();
        final LongAdder unique = new LongAdder();
        final LongAdder duplicates = new LongAdder();
        final LongAdder dataErrors = new LongAdder();
        volatile boolean throttled;
        volatile String skippedReason;
        volatile String lastError;

        SourceCounts freeze() {
            return SourceCounts.builder()
                    .pages(pages.sum())
                    .fetched(fetched.sum())
                    .unique(unique.sum())
                    .duplicates(duplicates.sum())
                    .dataErrors(dataErrors.sum())
                    .throttled(throttled)
                    .skippedReason(skippedReason)
                    .lastError(lastError)
                    .build();
        }
    }
}
