package com.storeradar.discovery.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Summary of one discovery run. Immutable once built.
 * Stored in the discovery_runs table and/or the runs CSV.
 */
@Value
@Builder
public class RunReport {

    String runId;                               // UUID
    Cadence cadence;
    Instant startedAt;
    Instant finishedAt;
    RunOutcome outcome;
    Map<String, SourceCounts> perSourceCounts;
    long totalCandidates;
    long totalNew;
    long totalRefreshed;
    long totalRejected;
    long totalDeferred;
    long totalDuplicates;
    long totalErrors;
    Map<RejectionStage, Long> rejectionsByStage;
    String failureMessage;                      // null unless FAILED
}
