package com.storeradar.discovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A deferred candidate that has no store record yet.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetryEntry {

    private String identityUrl;
    private String sourceName;
    private int retryCount;
    private Instant nextRetryAt;
    private String lastError;
}
