package com.storeradar.discovery.model;

import lombok.Builder;
import lombok.Value;

/**
 * What one adapter contributed to a run.
 */
@Value
@Builder
public class SourceCounts {

    long pages;
    long fetched;
    long unique;
    long duplicates;
    long dataErrors;
    boolean throttled;
    String skippedReason;       // non-null when the adapter did not run
    String lastError;
}
