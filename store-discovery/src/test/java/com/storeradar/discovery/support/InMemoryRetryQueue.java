package com.storeradar.discovery.support;

import com.storeradar.discovery.model.RetryEntry;
import com.storeradar.discovery.store.RetryQueue;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

public class InMemoryRetryQueue implements RetryQueue {

    private final Map<String, RetryEntry> entries = new ConcurrentHashMap<>();

    public Map<String, RetryEntry> entries() {
        return entries;
    }

    @Override
    public void save(RetryEntry entry) {
        entries.put(entry.getIdentityUrl(), entry.toBuilder().build());
    }

    @Override
    public void remove(String identityUrl) {
        entries.remove(identityUrl);
    }

    @Override
    public Map<String, RetryEntry> findBatch(Collection<String> identityUrls) {
        return identityUrls.stream()
                .filter(entries::containsKey)
                .collect(Collectors.toMap(Function.identity(), entries::get));
    }

    @Override
    public List<RetryEntry> findDue(Instant now, int limit) {
        return entries.values().stream()
                .filter(e -> e.getNextRetryAt() != null && !e.getNextRetryAt().isAfter(now))
                .sorted(Comparator.comparing(RetryEntry::getNextRetryAt))
                .limit(limit)
                .toList();
    }

    @Override
    public void ensureSchema() {
    }
}
