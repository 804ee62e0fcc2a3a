package com.storeradar.discovery.run;

import com.storeradar.discovery.config.RunSettings;
import com.storeradar.discovery.dedup.DedupResult;
import com.storeradar.discovery.dedup.Deduplicator;
import com.storeradar.discovery.error.FatalConfigurationException;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.model.RetryEntry;
import com.storeradar.discovery.model.RunOutcome;
import com.storeradar.discovery.model.RunReport;
import com.storeradar.discovery.model.StoreRecord;
import com.storeradar.discovery.model.ValidationMode;
import com.storeradar.discovery.normalize.UrlNormalizer;
import com.storeradar.discovery.output.RunReportRouter;
import com.storeradar.discovery.source.FetchResult;
import com.storeradar.discovery.source.SourceAdapter;
import com.storeradar.discovery.source.SourceRegistry;
import com.storeradar.discovery.store.RetryQueue;
import com.storeradar.discovery.store.StoreRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Orchestrates one discovery run.
 *
 * Order of work:
 *  1. seed due retries (stored records in REFRESH mode, queued deferrals in CREATE mode)
 *  2. walk the selected adapters in priority order, page by page; each page is normalized,
 *     deduplicated and handed to the validation pool straight away, so validation overlaps
 *     fetching
 *  3. wait for in-flight validations, then finalize and route the report
 *
 * Adapter failures never fail the run: a source that throws is counted and the run moves
 * on to the next one. Only a failure outside the adapters (retry seeding, the report) does.
 */
@Service
@Slf4j
public class DiscoveryRunService {

    static final String RETRY_SOURCE = "retry-queue";

    private final SourceRegistry sourceRegistry;
    private final Deduplicator deduplicator;
    private final CandidateProcessor processor;
    private final StoreRepository storeRepository;
    private final RetryQueue retryQueue;
    private final RunReportRouter reportRouter;
    private final Executor validationExecutor;
    private final Clock clock;

    public DiscoveryRunService(SourceRegistry sourceRegistry,
                               Deduplicator deduplicator,
                               CandidateProcessor processor,
                               StoreRepository storeRepository,
                               RetryQueue retryQueue,
                               RunReportRouter reportRouter,
                               @Qualifier("validationExecutor") Executor validationExecutor,
                               Clock clock) {
        this.sourceRegistry = sourceRegistry;
        this.deduplicator = deduplicator;
        this.processor = processor;
        this.storeRepository = storeRepository;
        this.retryQueue = retryQueue;
        this.reportRouter = reportRouter;
        this.validationExecutor = validationExecutor;
        this.clock = clock;
    }

    /**
     * Checks that must pass before any adapter is touched.
     *
     * @throws FatalConfigurationException store unreachable, or no usable adapter
     */
    public void preflight(RunSettings settings) {
        storeRepository.ping();
        boolean anyUsable = sourceRegistry.select(settings).stream().anyMatch(SourceAdapter::isConfigured);
        if (!anyUsable) {
            throw new FatalConfigurationException("No source adapter enabled and configured for cadence " + settings.getCadence());
        }
    }

    public RunContext open(RunSettings settings) {
        return new RunContext(UUID.randomUUID().toString(), settings, clock.instant());
    }

    /**
     * Report for a run that never got past preflight.
     */
    public RunReport abort(RunSettings settings, FatalConfigurationException cause) {
        RunContext ctx = open(settings);
        RunReport report = ctx.getReporter().finish(RunOutcome.FAILED, clock.instant(), cause.getMessage());
        reportRouter.write(report);
        return report;
    }

    public RunReport execute(RunContext ctx) {
        RunSettings settings = ctx.getSettings();
        log.info("Run {} ({}) started", ctx.getRunId(), settings.getCadence());

        RunOutcome outcome = RunOutcome.COMPLETED;
        String failure = null;
        try {
            seedRetries(ctx);

            List<SourceAdapter> adapters = sourceRegistry.select(settings);
            for (int i = 0; i < adapters.size(); i++) {
                if (ctx.isCancelled()) break;
                if (ctx.isQuotaReached()) {
                    log.info("Run {}: candidate quota of {} reached, no more sources", ctx.getRunId(), settings.getCandidateQuota());
                    break;
                }
                runAdapterGuarded(adapters.get(i), ctx);
                if (i < adapters.size() - 1 && ctx.awaitCancellation(settings.getInterAdapterDelay())) break;
            }

            awaitValidations(ctx);
            if (ctx.isCancelled()) {
                outcome = RunOutcome.CANCELLED;
            }
        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", ctx.getRunId(), e.getMessage(), e);
            outcome = RunOutcome.FAILED;
            failure = e.getMessage();
            ctx.cancel();
            awaitValidations(ctx);
        }

        RunReport report = ctx.getReporter().finish(outcome, clock.instant(), failure);
        reportRouter.write(report);

        log.info("Run {} {}: {} candidates, {} new, {} refreshed, {} rejected, {} deferred, {} duplicates, {} errors",
                report.getRunId(), report.getOutcome(), report.getTotalCandidates(), report.getTotalNew(),
                report.getTotalRefreshed(), report.getTotalRejected(), report.getTotalDeferred(),
                report.getTotalDuplicates(), report.getTotalErrors());
        return report;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void seedRetries(RunContext ctx) {
        Instant now = clock.instant();
        int limit = ctx.getSettings().getRetrySeedLimit();

        List<Candidate> seeds = new ArrayList<>();
        for (StoreRecord record : storeRepository.findDueForRetry(now, limit)) {
            seeds.add(seed(record.getIdentityUrl(), ValidationMode.REFRESH, now));
        }
        for (RetryEntry entry : retryQueue.findDue(now, limit)) {
            seeds.add(seed(entry.getIdentityUrl(), ValidationMode.CREATE, now));
        }

        int submitted = 0;
        for (Candidate c : seeds) {
            if (ctx.getSeen().add(c.getNormalizedUrl())) {
                submit(c, ctx);
                submitted++;
            }
        }
        if (submitted > 0) {
            ctx.getReporter().seeded(RETRY_SOURCE, submitted);
            log.info("Run {}: {} due retries queued for validation", ctx.getRunId(), submitted);
        }
    }

    private Candidate seed(String identityUrl, ValidationMode mode, Instant now) {
        return Candidate.builder()
                .rawUrl(identityUrl)
                .normalizedUrl(identityUrl)
                .sourceName(RETRY_SOURCE)
                .discoveredAt(now)
                .mode(mode)
                .build();
    }

    private void runAdapterGuarded(SourceAdapter adapter, RunContext ctx) {
        try {
            runAdapter(adapter, ctx);
        } catch (RuntimeException e) {
            log.warn("[{}] failed, moving on to the next source: {}", adapter.name(), e.getMessage(), e);
            ctx.getReporter().sourceFailed(adapter.name(), e.getMessage());
        }
    }

    private void runAdapter(SourceAdapter adapter, RunContext ctx) {
        String name = adapter.name();
        RunReporter reporter = ctx.getReporter();

        if (!adapter.isConfigured()) {
            log.info("[{}] skipped: not configured", name);
            reporter.sourceSkipped(name, "not configured");
            return;
        }
        if (adapter.rateLimiter().isBackingOff()) {
            log.info("[{}] skipped: backing off until {}", name, adapter.rateLimiter().backoffUntil());
            reporter.sourceSkipped(name, "backing off until " + adapter.rateLimiter().backoffUntil());
            return;
        }

        String cursor = adapter.state().getCursor();
        log.info("[{}] fetching from cursor {}", name, cursor == null ? "<start>" : cursor);

        int pages = 0;
        while (pages < adapter.maxPagesPerRun() && !ctx.isCancelled() && !ctx.isQuotaReached()) {
            if (adapter.rateLimiter().isBackingOff()) {
                log.info("[{}] paused after {} pages, backing off until {}", name, pages, adapter.rateLimiter().backoffUntil());
                break;
            }
            FetchResult result = adapter.fetch(cursor, ctx);
            pages++;
            reporter.pageFetched(name, result);

            List<Candidate> normalized = result.getCandidates().stream()
                    .map(c -> c.toBuilder().normalizedUrl(UrlNormalizer.normalize(c.getRawUrl())).build())
                    .toList();
            DedupResult dedup = deduplicator.filter(normalized, ctx.getSeen(), ctx.getSettings());
            reporter.deduplicated(name, dedup);
            platformHostsFirst(dedup.getAccepted()).forEach(c -> submit(c, ctx));

            cursor = result.getNextCursor();
            adapter.state().setCursor(cursor);

            if (result.isCancelled()) {
                log.info("[{}] stopped after {} pages: run cancelled", name, pages);
                break;
            }
            if (result.isThrottled()) {
                log.warn("[{}] throttled after {} pages, will resume at cursor {}", name, pages, cursor);
                break;
            }
            if (result.isFailed()) {
                log.warn("[{}] stopped after {} pages: {}", name, pages, result.getError());
                break;
            }
            if (result.isExhausted()) {
                log.info("[{}] exhausted after {} pages", name, pages);
                break;
            }
        }
    }

    /**
     * Stable reorder putting {@code *.myshopify.com} hosts ahead of custom domains, so they
     * are validated first and win any remaining candidate quota.
     */
    static List<Candidate> platformHostsFirst(List<Candidate> candidates) {
        return candidates.stream()
                .sorted(Comparator.comparing((Candidate c) -> !UrlNormalizer.isPlatformHost(c.getNormalizedUrl())))
                .toList();
    }

    private void submit(Candidate candidate, RunContext ctx) {
        ctx.track(CompletableFuture.runAsync(() -> processor.process(candidate, ctx), validationExecutor));
    }

    private void awaitValidations(RunContext ctx) {
        List<CompletableFuture<Void>> inFlight = ctx.inFlight();
        if (inFlight.isEmpty()) return;
        log.info("Run {}: waiting for {} validations", ctx.getRunId(), inFlight.size());
        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0]))
                .exceptionally(t -> {
                    log.warn("Run {}: validation task failed: {}", ctx.getRunId(), t.getMessage());
                    return null;
                })
                .join();
    }
}
