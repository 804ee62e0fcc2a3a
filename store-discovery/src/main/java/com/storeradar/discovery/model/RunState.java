package com.storeradar.discovery.model;

public enum RunState {
    IDLE, RUNNING, COMPLETED, FAILED, CANCELLED;

    public static RunState of(RunOutcome outcome) {
        return switch (outcome) {
            case COMPLETED -> COMPLETED;
            case FAILED -> FAILED;
            case CANCELLED -> CANCELLED;
        };
    }
}
