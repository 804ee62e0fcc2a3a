package com.storeradar.discovery.dedup;

import com.storeradar.discovery.config.RunSettings;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.model.RetryEntry;
import com.storeradar.discovery.model.StoreRecord;
import com.storeradar.discovery.model.ValidationMode;
import com.storeradar.discovery.normalize.UrlNormalizer;
import com.storeradar.discovery.store.RetryQueue;
import com.storeradar.discovery.store.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two-phase filter between the adapters and the validation pipeline.
 *
 * Phase one claims each identity in the run's seen-set; the first adapter to produce an
 * identity owns it. Phase two checks the survivors against the store in batches: known
 * records are dropped unless due for revalidation (then routed in REFRESH mode), unknown
 * ones are dropped while they wait out a deferral in the retry queue.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class Deduplicator {

    private final StoreRepository storeRepository;
    private final RetryQueue retryQueue;
    private final Clock clock;

    /**
     * @param candidates normalized candidates from one page
     * @param seen       the run's concurrent seen-set; updated in place
     */
    public DedupResult filter(List<Candidate> candidates, Set<String> seen, RunSettings settings) {
        int invalid = 0;
        int seenInRun = 0;
        List<Candidate> fresh = new ArrayList<>();

        for (Candidate c : candidates) {
            String url = c.getNormalizedUrl();
            if (!UrlNormalizer.isValid(url)) {
                invalid++;
            } else if (!seen.add(url)) {
                seenInRun++;
            } else {
                fresh.add(c);
            }
        }

        Instant now = clock.instant();
        List<Candidate> accepted = new ArrayList<>();
        int alreadyKnown = 0;
        int awaitingRetry = 0;

        int batchSize = settings.getDedupBatchSize();
        for (int i = 0; i < fresh.size(); i += batchSize) {
            List<Candidate> batch = fresh.subList(i, Math.min(i + batchSize, fresh.size()));
            List<String> urls = batch.stream().map(Candidate::getNormalizedUrl).toList();

            Set<String> known = storeRepository.existsBatch(urls);
            Map<String, StoreRecord> records = known.isEmpty() ? Map.of() : storeRepository.findBatch(known);
            List<String> unknown = urls.stream().filter(u -> !known.contains(u)).toList();
            Map<String, RetryEntry> waiting = unknown.isEmpty() ? Map.of() : retryQueue.findBatch(unknown);

            for (Candidate c : batch) {
                String url = c.getNormalizedUrl();
                if (known.contains(url)) {
                    StoreRecord record = records.get(url);
                    if (record != null && isDue(record, now, settings)) {
                        accepted.add(c.toBuilder().mode(ValidationMode.REFRESH).build());
                    } else {
                        alreadyKnown++;
                    }
                } else {
                    RetryEntry entry = waiting.get(url);
                    if (entry != null && entry.getNextRetryAt() != null && entry.getNextRetryAt().isAfter(now)) {
                        awaitingRetry++;
                    } else {
                        accepted.add(c.toBuilder().mode(ValidationMode.CREATE).build());
                    }
                }
            }
        }

        log.debug("Dedup: {} in, {} out ({} invalid, {} seen, {} known, {} waiting)",
                candidates.size(), accepted.size(), invalid, seenInRun, alreadyKnown, awaitingRetry);

        return DedupResult.builder()
                .accepted(List.copyOf(accepted))
                .invalid(invalid)
                .seenInRun(seenInRun)
                .alreadyKnown(alreadyKnown)
                .awaitingRetry(awaitingRetry)
                .build();
    }

    /**
     * A scheduled retry wins over staleness: a record waiting on nextRetryAt is not
     * revalidated early just because it is old.
     */
    static boolean isDue(StoreRecord record, Instant now, RunSettings settings) {
        if (record.getNextRetryAt() != null) {
            return !now.isBefore(record.getNextRetryAt());
        }
        Instant validated = record.getLastValidatedAt();
        return validated == null || validated.isBefore(now.minus(settings.getStaleness()));
    }
}
