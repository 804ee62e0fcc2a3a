package com.storeradar.discovery.run;

import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.config.RunSettings;
import com.storeradar.discovery.error.FatalConfigurationException;
import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.model.RunReport;
import com.storeradar.discovery.model.RunState;
import com.storeradar.discovery.model.RunStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Admits one run at a time.
 *
 * A trigger that arrives while a run is active is coalesced: at most one follow-up run is
 * queued, the broadest cadence asked for wins, and it starts as soon as the active run
 * ends. Preflight runs on the caller's thread, so a fatal configuration problem reaches
 * whoever triggered the run. The slot is reserved before preflight and preflight itself
 * runs outside the lock, so status and cancel stay responsive while the store is slow.
 */
@Component
@Slf4j
public class RunCoordinator {

    private final DiscoveryRunService runService;
    private final RunHistory history;
    private final DiscoveryProperties properties;
    private final Executor runLauncher;

    private RunContext current;         // guarded by this
    private Cadence starting;           // guarded by this; set while preflight is in progress
    private boolean cancelOnStart;      // guarded by this
    private Cadence queued;             // guarded by this

    public RunCoordinator(DiscoveryRunService runService,
                          RunHistory history,
                          DiscoveryProperties properties,
                          @Qualifier("runLauncher") Executor runLauncher) {
        this.runService = runService;
        this.history = history;
        this.properties = properties;
        this.runLauncher = runLauncher;
    }

    /**
     * Start a run in the background, or queue it behind the active one.
     *
     * @throws FatalConfigurationException when preflight fails; nothing is started
     */
    public TriggerResult trigger(Cadence cadence) {
        synchronized (this) {
            if (busy()) {
                queued = Cadence.broadest(queued, cadence);
                log.info("Run {} active, {} trigger coalesced (queued: {})", activeRunId(), cadence, queued);
                return TriggerResult.queued(activeRunId(), queued);
            }
            starting = cadence;
        }
        RunContext ctx = start(cadence);
        runLauncher.execute(() -> runAndDrain(ctx));
        return TriggerResult.started(ctx.getRunId(), cadence);
    }

    /**
     * Run on the calling thread. Empty when another run is active (the request is queued).
     */
    public Optional<RunReport> runNow(Cadence cadence) {
        synchronized (this) {
            if (busy()) {
                queued = Cadence.broadest(queued, cadence);
                return Optional.empty();
            }
            starting = cadence;
        }
        RunContext ctx = start(cadence);
        return Optional.of(runAndDrain(ctx));
    }

    /**
     * Stop the active run after its in-flight validations and drop any queued follow-up.
     * A run still in preflight is cancelled as soon as it opens.
     *
     * @return false when nothing was running
     */
    public synchronized boolean cancel() {
        queued = null;
        if (current == null) {
            if (starting == null) return false;
            log.info("Cancelling {} run still in preflight", starting);
            cancelOnStart = true;
            return true;
        }
        log.info("Cancelling run {}", current.getRunId());
        current.cancel();
        return true;
    }

    @PreDestroy
    public void shutdown() {
        cancel();
    }

    public synchronized RunStatus status() {
        RunState state = busy()
                ? RunState.RUNNING
                : history.lastReport().map(r -> RunState.of(r.getOutcome())).orElse(RunState.IDLE);

        return RunStatus.builder()
                .state(state)
                .currentRunId(current != null ? current.getRunId() : null)
                .currentCadence(current != null ? current.getCadence() : starting)
                .currentRunStartedAt(current != null ? current.getStartedAt() : null)
                .queuedCadence(queued)
                .lastRunAt(history.lastRunAt())
                .runsCompleted(history.runsCompleted())
                .totalCandidates(history.totalCandidates())
                .totalNew(history.totalNew())
                .totalRefreshed(history.totalRefreshed())
                .totalRejected(history.totalRejected())
                .totalErrors(history.totalErrors())
                .lastReport(history.lastReport().orElse(null))
                .build();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean busy() {
        return current != null || starting != null;
    }

    private String activeRunId() {
        return current != null ? current.getRunId() : null;
    }

    /** Caller has reserved the slot and does not hold the lock. */
    private RunContext start(Cadence cadence) {
        RunSettings settings = RunSettings.snapshot(properties, cadence);
        RunContext ctx = null;
        try {
            runService.preflight(settings);
            ctx = runService.open(settings);
        } catch (FatalConfigurationException e) {
            log.error("{} run not started: {}", cadence, e.getMessage());
            history.record(runService.abort(settings, e));
            throw e;
        } finally {
            synchronized (this) {
                starting = null;
                if (ctx == null) {
                    queued = null;
                } else {
                    current = ctx;
                    if (cancelOnStart) {
                        log.info("Cancelling run {}", ctx.getRunId());
                        ctx.cancel();
                    }
                }
                cancelOnStart = false;
            }
        }
        return ctx;
    }

    private RunReport runAndDrain(RunContext ctx) {
        try {
            RunReport report = runService.execute(ctx);
            history.record(report);
            return report;
        } finally {
            Cadence next;
            synchronized (this) {
                current = null;
                next = queued;
                queued = null;
                if (next != null) {
                    starting = next;
                }
            }
            if (next != null) {
                launchQueued(next);
            }
        }
    }

    private void launchQueued(Cadence cadence) {
        try {
            RunContext ctx = start(cadence);
            log.info("Starting queued {} run {}", cadence, ctx.getRunId());
            runLauncher.execute(() -> runAndDrain(ctx));
        } catch (FatalConfigurationException e) {
            log.error("Queued {} run dropped: {}", cadence, e.getMessage());
        }
    }
}
