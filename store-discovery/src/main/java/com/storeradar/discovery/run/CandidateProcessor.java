package com.storeradar.discovery.run;

import com.storeradar.discovery.event.CandidateRejectedEvent;
import com.storeradar.discovery.event.DiscoveryEventPublisher;
import com.storeradar.discovery.event.StoreAcceptedEvent;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.model.RetryEntry;
import com.storeradar.discovery.model.StoreRecord;
import com.storeradar.discovery.model.ValidationMode;
import com.storeradar.discovery.model.ValidationOutcome;
import com.storeradar.discovery.store.RetryPolicy;
import com.storeradar.discovery.store.RetryQueue;
import com.storeradar.discovery.store.StoreRepository;
import com.storeradar.discovery.store.UpsertResult;
import com.storeradar.discovery.validation.ValidationPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Validates one candidate and applies the outcome.
 *
 * ACCEPTED   upsert; create mode also clears any retry-queue entry
 * REJECTED   create mode: clear the retry-queue entry; refresh mode: deactivate the record
 * DEFERRED   bump retryCount and push nextRetryAt, on the queue entry or on the record;
 *            a create-mode candidate past maxRetries is dropped and counted as an error
 *
 * Runs on the validation pool. Any unexpected failure is counted, never rethrown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CandidateProcessor {

    private final ValidationPipeline pipeline;
    private final StoreRepository storeRepository;
    private final RetryQueue retryQueue;
    private final DiscoveryEventPublisher events;
    private final Clock clock;

    public void process(Candidate candidate, RunContext ctx) {
        if (ctx.isCancelled()) {
            log.debug("Run {} cancelled, skipping {}", ctx.getRunId(), candidate.getNormalizedUrl());
            return;
        }

        String url = candidate.getNormalizedUrl();
        try {
            StoreRecord existing = candidate.getMode() == ValidationMode.REFRESH
                    ? storeRepository.findByIdentityUrl(url).orElse(null)
                    : null;

            ValidationOutcome outcome = pipeline.validate(candidate, existing, ctx.getSettings());
            switch (outcome.getStatus()) {
                case ACCEPTED -> onAccepted(candidate, existing, outcome.getRecord(), ctx);
                case REJECTED -> onRejected(candidate, existing, outcome, ctx);
                case DEFERRED -> onDeferred(candidate, existing, outcome.getReason(), ctx);
            }
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing {}: {}", url, e.getMessage(), e);
            ctx.getReporter().error();
        }
    }

    private void onAccepted(Candidate candidate, StoreRecord existing, StoreRecord record, RunContext ctx) {
        UpsertResult result = storeRepository.upsert(record);
        if (existing == null) {
            retryQueue.remove(record.getIdentityUrl());
        }
        ctx.getReporter().accepted(result);
        events.storeAccepted(new StoreAcceptedEvent(ctx.getRunId(), record, result == UpsertResult.CREATED));
    }

    private void onRejected(Candidate candidate, StoreRecord existing, ValidationOutcome outcome, RunContext ctx) {
        String url = candidate.getNormalizedUrl();
        if (existing != null) {
            storeRepository.markInactive(url, clock.instant());
            log.info("{} deactivated on refresh: {} ({})", url, outcome.getStage(), outcome.getReason());
        } else {
            retryQueue.remove(url);
        }
        ctx.getReporter().rejected(outcome.getStage());
        events.candidateRejected(new CandidateRejectedEvent(ctx.getRunId(), url, candidate.getSourceName(),
                existing != null ? ValidationMode.REFRESH : ValidationMode.CREATE,
                outcome.getStage(), outcome.getReason()));
    }

    private void onDeferred(Candidate candidate, StoreRecord existing, String reason, RunContext ctx) {
        String url = candidate.getNormalizedUrl();
        RetryPolicy policy = RetryPolicy.from(ctx.getSettings());
        Instant now = clock.instant();

        if (existing != null) {
            int count = existing.getRetryCount() + 1;
            storeRepository.scheduleRetry(url, count, policy.nextRetryAt(now, count));
            ctx.getReporter().deferred();
            return;
        }

        RetryEntry entry = retryQueue.findBatch(List.of(url)).get(url);
        int count = (entry == null ? 0 : entry.getRetryCount()) + 1;
        if (policy.isExhausted(count)) {
            retryQueue.remove(url);
            ctx.getReporter().error();
            log.info("{} dropped after {} deferrals, last: {}", url, count - 1, reason);
            return;
        }

        retryQueue.save(RetryEntry.builder()
                .identityUrl(url)
                .sourceName(entry != null ? entry.getSourceName() : candidate.getSourceName())
                .retryCount(count)
                .nextRetryAt(policy.nextRetryAt(now, count))
                .lastError(reason)
                .build());
        ctx.getReporter().deferred();
    }
}
