package com.storeradar.discovery.run;

import com.storeradar.discovery.model.Cadence;

/**
 * Answer to a run trigger: started now, or coalesced behind the active run.
 *
 * @param runId the new run's id when STARTED, the active run's id when QUEUED (null while that run is still in preflight)
 */
public record TriggerResult(Status status, String runId, Cadence cadence) {

    public enum Status { STARTED, QUEUED }

    static TriggerResult started(String runId, Cadence cadence) {
        return new TriggerResult(Status.STARTED, runId, cadence);
    }

    static TriggerResult queued(String activeRunId, Cadence queuedCadence) {
        return new TriggerResult(Status.QUEUED, activeRunId, queuedCadence);
    }
}
