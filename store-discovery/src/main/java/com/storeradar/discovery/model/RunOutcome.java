package com.storeradar.discovery.model;

public enum RunOutcome {
    COMPLETED, FAILED, CANCELLED
}
