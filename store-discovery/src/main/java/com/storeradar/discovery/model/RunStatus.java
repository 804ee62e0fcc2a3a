package com.storeradar.discovery.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view served by GET /discovery/status.
 */
@Value
@Builder
public class RunStatus {

    RunState state;
    String currentRunId;
    Cadence currentCadence;
    Instant currentRunStartedAt;
    Cadence queuedCadence;
    Map<Cadence, Instant> lastRunAt;
    long runsCompleted;
    long totalCandidates;
    long totalNew;
    long totalRefreshed;
    long totalRejected;
    long totalErrors;
    RunReport lastReport;
}
