package com.storeradar.discovery.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A URL produced by a source adapter, on its way through dedup and validation.
 * Never persisted.
 */
@Value
@Builder(toBuilder = true)
public class Candidate {

    String rawUrl;
    String normalizedUrl;           // filled in by the normalizer, INVALID sentinel when unparseable
    String sourceName;
    @Builder.Default
    Map<String, String> sourceMetadata = Map.of();
    Instant discoveredAt;
    ValidationMode mode;            // null until routed by the deduplicator

    public boolean isRunningAds() {
        return "true".equals(sourceMetadata.get(SourceMetadataKeys.RUNNING_ADS));
    }
}
