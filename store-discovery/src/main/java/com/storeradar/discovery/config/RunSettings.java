package com.storeradar.discovery.config;

import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.model.PriorityTier;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration frozen at run start. A run never sees a property change mid-flight.
 */
@Value
@Builder
public class RunSettings {

    Cadence cadence;
    PriorityTier tierCeiling;
    List<String> explicitAdapters;
    Set<String> disabledAdapters;
    int candidateQuota;
    Duration interAdapterDelay;
    Duration validationTimeout;
    double confidenceThreshold;
    Duration reclassifyDelay;
    int maxReclassificationAttempts;
    int maxProductPages;
    int dedupBatchSize;
    Duration retryBase;
    Duration retryCeiling;
    int maxRetries;
    Duration staleness;
    int retrySeedLimit;

    public static RunSettings snapshot(DiscoveryProperties properties, Cadence cadence) {
        DiscoveryProperties.CadenceSettings c = properties.cadence(cadence);
        DiscoveryProperties.Pipeline p = properties.getPipeline();
        DiscoveryProperties.Retry r = properties.getRetry();

        Set<String> disabled = properties.getSources().entrySet().stream()
                .filter(e -> !e.getValue().isEnabled())
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());

        return RunSettings.builder()
                .cadence(cadence)
                .tierCeiling(c.getTierCeiling() != null ? c.getTierCeiling() : PriorityTier.EXPENSIVE)
                .explicitAdapters(List.copyOf(c.getAdapters()))
                .disabledAdapters(disabled)
                .candidateQuota(c.getCandidateQuota())
                .interAdapterDelay(properties.getScheduling().getInterAdapterDelay())
                .validationTimeout(p.getValidationTimeout())
                .confidenceThreshold(p.getConfidenceThreshold())
                .reclassifyDelay(p.getReclassifyDelay())
                .maxReclassificationAttempts(p.getMaxReclassificationAttempts())
                .maxProductPages(p.getMaxProductPages())
                .dedupBatchSize(Math.max(1, p.getDedupBatchSize()))
                .retryBase(r.getBase())
                .retryCeiling(r.getCeiling())
                .maxRetries(r.getMaxRetries())
                .staleness(r.getStaleness())
                .retrySeedLimit(r.getSeedLimit())
                .build();
    }

    /**
     * Whether an adapter of the given name and tier takes part in this run.
     */
    public boolean includes(String adapterName, PriorityTier tier) {
        if (disabledAdapters.contains(adapterName)) return false;
        if (!explicitAdapters.isEmpty()) return explicitAdapters.contains(adapterName);
        return tier.isWithin(tierCeiling);
    }

    public boolean hasQuota() {
        return candidateQuota > 0;
    }
}
