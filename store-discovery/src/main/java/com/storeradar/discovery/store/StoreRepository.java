package com.storeradar.discovery.store;

import com.storeradar.discovery.model.StoreRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent store of validated storefronts, keyed by identity URL.
 * The unique key is the only guard against concurrent writers.
 */
public interface StoreRepository {

    /**
     * Insert, or refresh the existing row. Classification columns are left alone when the
     * stored row has tagsLocked set; firstSeenAt and sourceName never change.
     */
    UpsertResult upsert(StoreRecord record);

    Optional<StoreRecord> findByIdentityUrl(String identityUrl);

    Set<String> existsBatch(Collection<String> identityUrls);

    Map<String, StoreRecord> findBatch(Collection<String> identityUrls);

    /**
     * Records whose nextRetryAt has passed, oldest first.
     */
    List<StoreRecord> findDueForRetry(Instant now, int limit);

    /**
     * Refresh pass hard-rejected the store: keep the row, flag it inactive.
     */
    void markInactive(String identityUrl, Instant validatedAt);

    void scheduleRetry(String identityUrl, int retryCount, Instant nextRetryAt);

    /**
     * Cheap reachability check run before every discovery run.
     *
     * @throws com.storeradar.discovery.error.FatalConfigurationException when unreachable
     */
    void ping();

    void ensureSchema();
}
