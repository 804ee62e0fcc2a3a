package com.storeradar.discovery.store;

import com.storeradar.discovery.model.RetryEntry;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Deferred candidates that have no store record yet.
 */
public interface RetryQueue {

    void save(RetryEntry entry);

    void remove(String identityUrl);

    Map<String, RetryEntry> findBatch(Collection<String> identityUrls);

    List<RetryEntry> findDue(Instant now, int limit);

    void ensureSchema();
}
