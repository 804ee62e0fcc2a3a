package com.storeradar.discovery.support;

import com.storeradar.discovery.config.RunSettings;
import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.model.PriorityTier;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Run settings with production defaults and no pacing, for tests to tweak.
 */
public final class TestSettings {

    private TestSettings() {
    }

    public static RunSettings.RunSettingsBuilder builder() {
        return RunSettings.builder()
                .cadence(Cadence.MANUAL)
                .tierCeiling(PriorityTier.EXPENSIVE)
                .explicitAdapters(List.of())
                .disabledAdapters(Set.of())
                .candidateQuota(0)
                .interAdapterDelay(Duration.ZERO)
                .validationTimeout(Duration.ofSeconds(5))
                .confidenceThreshold(0.7)
                .reclassifyDelay(Duration.ofHours(24))
                .maxReclassificationAttempts(5)
                .maxProductPages(4)
                .dedupBatchSize(500)
                .retryBase(Duration.ofHours(1))
                .retryCeiling(Duration.ofHours(24))
                .maxRetries(5)
                .staleness(Duration.ofDays(7))
                .retrySeedLimit(200);
    }

    public static RunSettings defaults() {
        return builder().build();
    }
}
