package com.storeradar.discovery.scheduler;

import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.output.RunReportRouter;
import com.storeradar.discovery.run.RunCoordinator;
import com.storeradar.discovery.store.RetryQueue;
import com.storeradar.discovery.store.StoreRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Schedules the recurring cadences and the optional startup run.
 *
 * Defaults: fast every 15 minutes, deep every 6 hours, comprehensive daily at 03:00 UTC.
 * Override with discovery.scheduling.&lt;cadence&gt;.cron; "-" disables a cadence.
 * A trigger that fires while a run is active is coalesced by the coordinator.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DiscoveryScheduler {

    private final RunCoordinator coordinator;
    private final StoreRepository storeRepository;
    private final RetryQueue retryQueue;
    private final RunReportRouter reportRouter;
    private final DiscoveryProperties properties;

    /**
     * On application startup:
     *  1. Ensure every table exists
     *  2. Optionally start a run if discovery.scheduling.run-on-startup=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            storeRepository.ensureSchema();
            retryQueue.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise store schema (database unavailable?): {}", e.getMessage());
        }
        try {
            reportRouter.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise run report schema: {}", e.getMessage());
        }

        DiscoveryProperties.Scheduling scheduling = properties.getScheduling();
        if (scheduling.isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, starting {} run", scheduling.getStartupCadence());
            fire(scheduling.getStartupCadence());
        } else {
            log.info("Discovery ready. Cadences: fast={} deep={} comprehensive={}",
                    scheduling.getFast().getCron(),
                    scheduling.getDeep().getCron(),
                    scheduling.getComprehensive().getCron());
        }
    }

    @Scheduled(cron = "${discovery.scheduling.fast.cron:0 */15 * * * *}", zone = "UTC")
    public void fastRun() {
        fire(Cadence.FAST);
    }

    @Scheduled(cron = "${discovery.scheduling.deep.cron:0 0 */6 * * *}", zone = "UTC")
    public void deepRun() {
        fire(Cadence.DEEP);
    }

    @Scheduled(cron = "${discovery.scheduling.comprehensive.cron:0 0 3 * * *}", zone = "UTC")
    public void comprehensiveRun() {
        fire(Cadence.COMPREHENSIVE);
    }

    private void fire(Cadence cadence) {
        log.debug("Scheduled {} run triggered", cadence);
        try {
            coordinator.trigger(cadence);
        } catch (Exception e) {
            log.error("Scheduled {} run failed to start: {}", cadence, e.getMessage(), e);
        }
    }
}
