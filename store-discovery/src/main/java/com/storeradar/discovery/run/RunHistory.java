package com.storeradar.discovery.run;

import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.model.RunReport;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Finished runs, as far as the status endpoint cares: the last report, when each
 * cadence last ran, and totals since startup.
 */
@Component
public class RunHistory {

    private final AtomicReference<RunReport> lastReport = new AtomicReference<>();
    private final Map<Cadence, Instant> lastRunAt = new EnumMap<>(Cadence.class);

    private final LongAdder runsCompleted = new LongAdder();
    private final LongAdder candidates = new LongAdder();
    private final LongAdder created = new LongAdder();
    private final LongAdder refreshed = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder errors = new LongAdder();

    public void record(RunReport report) {
        lastReport.set(report);
        synchronized (lastRunAt) {
            lastRunAt.put(report.getCadence(), report.getStartedAt());
        }
        runsCompleted.increment();
        candidates.add(report.getTotalCandidates());
        created.add(report.getTotalNew());
        refreshed.add(report.getTotalRefreshed());
        rejected.add(report.getTotalRejected());
        errors.add(report.getTotalErrors());
    }

    public Optional<RunReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public Map<Cadence, Instant> lastRunAt() {
        synchronized (lastRunAt) {
            return Map.copyOf(lastRunAt);
        }
    }

    public long runsCompleted() {
        return runsCompleted.sum();
    }

    public long totalCandidates() {
        return candidates.sum();
    }

    public long totalNew() {
        return created.sum();
    }

    public long totalRefreshed() {
        return refreshed.sum();
    }

    public long totalRejected() {
        return rejected.sum();
    }

    public long totalErrors() {
        return errors.sum();
    }
}
