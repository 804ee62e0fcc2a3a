package com.storeradar.discovery.support;

import com.storeradar.discovery.error.FatalConfigurationException;
import com.storeradar.discovery.model.StoreRecord;
import com.storeradar.discovery.store.StoreRepository;
import com.storeradar.discovery.store.UpsertResult;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Store keyed by identity URL with the same upsert rules as the JDBC repository.
 */
public class InMemoryStoreRepository implements StoreRepository {

    private final Map<String, StoreRecord> rows = new ConcurrentHashMap<>();
    private final AtomicInteger upserts = new AtomicInteger();
    private volatile boolean reachable = true;

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public Map<String, StoreRecord> rows() {
        return rows;
    }

    public int upsertCount() {
        return upserts.get();
    }

    public void put(StoreRecord record) {
        rows.put(record.getIdentityUrl(), record.toBuilder().build());
    }

    @Override
    public UpsertResult upsert(StoreRecord record) {
        upserts.incrementAndGet();
        StoreRecord[] previous = new StoreRecord[1];
        rows.compute(record.getIdentityUrl(), (url, existing) -> {
            previous[0] = existing;
            if (existing == null) return record.toBuilder().build();
            StoreRecord merged = record.toBuilder()
                    .firstSeenAt(existing.getFirstSeenAt())
                    .sourceName(existing.getSourceName())
                    .tagsLocked(existing.isTagsLocked())
                    .build();
            if (existing.isTagsLocked()) {
                merged.setBusinessModel(existing.getBusinessModel());
                merged.setBusinessModelConfidence(existing.getBusinessModelConfidence());
                merged.setTags(existing.getTags());
            }
            return merged;
        });
        return previous[0] == null ? UpsertResult.CREATED : UpsertResult.REFRESHED;
    }

    @Override
    public Optional<StoreRecord> findByIdentityUrl(String identityUrl) {
        return Optional.ofNullable(rows.get(identityUrl)).map(r -> r.toBuilder().build());
    }

    @Override
    public Set<String> existsBatch(Collection<String> identityUrls) {
        return identityUrls.stream().filter(rows::containsKey).collect(Collectors.toSet());
    }

    @Override
    public Map<String, StoreRecord> findBatch(Collection<String> identityUrls) {
        return identityUrls.stream()
                .filter(rows::containsKey)
                .collect(Collectors.toMap(Function.identity(), u -> rows.get(u).toBuilder().build()));
    }

    @Override
    public List<StoreRecord> findDueForRetry(Instant now, int limit) {
        return rows.values().stream()
                .filter(r -> r.getNextRetryAt() != null && !r.getNextRetryAt().isAfter(now))
                .sorted(Comparator.comparing(StoreRecord::getNextRetryAt))
                .limit(limit)
                .toList();
    }

    @Override
    public void markInactive(String identityUrl, Instant validatedAt) {
        rows.computeIfPresent(identityUrl, (url, r) -> r.toBuilder()
                .active(false).lastValidatedAt(validatedAt).retryCount(0).nextRetryAt(null).build());
    }

    @Override
    public void scheduleRetry(String identityUrl, int retryCount, Instant nextRetryAt) {
        rows.computeIfPresent(identityUrl, (url, r) -> r.toBuilder()
                .retryCount(retryCount).nextRetryAt(nextRetryAt).build());
    }

    @Override
    public void ping() {
        if (!reachable) {
            throw new FatalConfigurationException("store unreachable");
        }
    }

    @Override
    public void ensureSchema() {
    }
}
