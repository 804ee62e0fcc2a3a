package com.storeradar.discovery.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of running one candidate through the validation stages.
 * Rejections are values, not exceptions.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationOutcome {

    public enum Status { ACCEPTED, REJECTED, DEFERRED }

    Status status;
    StoreRecord record;         // ACCEPTED only
    RejectionStage stage;       // REJECTED only
    String reason;

    public static ValidationOutcome accepted(StoreRecord record) {
        return new ValidationOutcome(Status.ACCEPTED, record, null, null);
    }

    public static ValidationOutcome rejected(RejectionStage stage, String reason) {
        return new ValidationOutcome(Status.REJECTED, null, stage, reason);
    }

    public static ValidationOutcome deferred(String reason) {
        return new ValidationOutcome(Status.DEFERRED, null, null, reason);
    }
}
