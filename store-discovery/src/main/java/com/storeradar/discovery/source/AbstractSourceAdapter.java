package com.storeradar.discovery.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.error.AdapterDataException;
import com.storeradar.discovery.error.AdapterTransportException;
import com.storeradar.discovery.error.FetchCancelledException;
import com.storeradar.discovery.error.SourceBackoffException;
import com.storeradar.discovery.model.AdapterState;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.model.PriorityTier;
import com.storeradar.discovery.ratelimit.CancellationSignal;
import com.storeradar.discovery.ratelimit.RateLimiter;
import com.storeradar.discovery.ratelimit.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing for REST-backed sources: rate limiting, throttle detection and
 * partial-result handling.
 *
 * Subclasses implement {@link #fetchPage(String, Page)} and push what they find into the
 * {@link Page}. A 429, or a 503/403 quota response, feeds the rate limiter's backoff and
 * returns what the page had collected so far with the incoming cursor kept, so the next
 * run resumes at the same spot.
 */
@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    private final String name;
    private final PriorityTier tier;
    private final AdapterState state;
    private final RateLimiter rateLimiter;

    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;
    protected final UrlTextScanner scanner;
    protected final DiscoveryProperties.Source settings;
    protected final Clock clock;

    private CancellationSignal cancellation = CancellationSignal.NEVER;     // set for the duration of fetch

    protected AbstractSourceAdapter(String name,
                                    PriorityTier tier,
                                    RestTemplate restTemplate,
                                    ObjectMapper objectMapper,
                                    UrlTextScanner scanner,
                                    DiscoveryProperties properties,
                                    Clock clock,
                                    Sleeper sleeper) {
        this.name = name;
        this.tier = tier;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.scanner = scanner;
        this.settings = properties.source(name);
        this.clock = clock;
        this.state = new AdapterState(name);
        this.rateLimiter = new RateLimiter(state, settings.rateLimitPolicy(), clock, sleeper);
    }

    /**
     * Fetch one page starting at {@code cursor} (null = from the beginning).
     * Call {@link Page#advance} or {@link Page#exhausted} once the page is complete.
     */
    protected abstract void fetchPage(String cursor, Page page) throws InterruptedException;

    @Override
    public final FetchResult fetch(String cursor, CancellationSignal cancellation) {
        Page page = new Page(cursor);
        this.cancellation = cancellation;
        try {
            fetchPage(cursor, page);
            rateLimiter.onSuccess();
            return page.complete();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return page.partial(false, "interrupted");

        } catch (FetchCancelledException e) {
            log.info("[{}] run cancelled, {} candidates kept from this page", name, page.size());
            return page.cancelled();

        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (isThrottle(status)) {
                rateLimiter.onThrottle();
                return page.partial(true, "HTTP " + status);
            }
            log.warn("[{}] request failed with HTTP {}: {}", name, status, e.getMessage());
            return page.partial(false, "HTTP " + status);

        } catch (SourceBackoffException e) {
            log.info("[{}] paused: {}", name, e.getMessage());
            return page.partial(true, e.getMessage());

        } catch (AdapterTransportException e) {
            if (e.isThrottled()) {
                rateLimiter.onThrottle();
                return page.partial(true, e.getMessage());
            }
            log.warn("[{}] transport failure: {}", name, e.getMessage());
            return page.partial(false, e.getMessage());

        } catch (RestClientException e) {
            log.warn("[{}] request failed: {}", name, e.getMessage());
            return page.partial(false, e.getMessage());

        } finally {
            this.cancellation = CancellationSignal.NEVER;
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public PriorityTier tier() {
        return tier;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public AdapterState state() {
        return state;
    }

    @Override
    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    @Override
    public int maxPagesPerRun() {
        return settings.getMaxPagesPerRun();
    }

    protected String baseUrl(String defaultBaseUrl) {
        String configured = settings.getBaseUrl();
        return configured == null || configured.isBlank() ? defaultBaseUrl : configured;
    }

    protected static boolean isThrottle(int status) {
        return status == 429 || status == 503 || status == 403;
    }

    // ── HTTP helpers ─────────────────────────────────────────────────────────

    /**
     * Waits for the next request slot. Call before every upstream request.
     */
    protected void acquirePermit() throws InterruptedException {
        rateLimiter.acquire(cancellation);
    }

    protected String getText(URI uri) throws InterruptedException {
        acquirePermit();
        log.debug("[{}] GET {}", name, uri);
        String body = restTemplate.getForObject(uri, String.class);
        return body == null ? "" : body;
    }

    protected JsonNode getJson(URI uri) throws InterruptedException {
        String body = getText(uri);
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AdapterTransportException("Unparseable response from " + uri.getHost(), false, e);
        }
    }

    protected JsonNode parseRecord(String line) {
        try {
            return objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new AdapterDataException("Malformed record: " + abbreviate(line), e);
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 80) + "...";
    }

    // ── Page accumulator ─────────────────────────────────────────────────────

    /**
     * Collects candidates for one page. Survives a mid-page failure so partial results
     * are not lost.
     */
    public final class Page {

        private final String incomingCursor;
        private final List<Candidate> candidates = new ArrayList<>();
        private int dataErrors;
        private String nextCursor;
        private boolean exhausted;
        private boolean finished;

        private Page(String incomingCursor) {
            this.incomingCursor = incomingCursor;
        }

        public void add(String rawUrl, Map<String, String> metadata) {
            candidates.add(Candidate.builder()
                    .rawUrl(rawUrl)
                    .sourceName(name)
                    .sourceMetadata(metadata == null ? Map.of() : Map.copyOf(metadata))
                    .discoveredAt(clock.instant())
                    .build());
        }

        public void addAll(List<String> rawUrls, Map<String, String> metadata) {
            rawUrls.forEach(url -> add(url, metadata));
        }

        public void dataError(String detail) {
            dataErrors++;
            log.debug("[{}] skipped malformed record: {}", name, detail);
        }

        /** More pages follow, starting at {@code cursor}. */
        public void advance(String cursor) {
            this.nextCursor = cursor;
            this.exhausted = false;
            this.finished = true;
        }

        /** Nothing left; the next call starts at {@code resumeCursor} (null = from scratch). */
        public void exhausted(String resumeCursor) {
            this.nextCursor = resumeCursor;
            this.exhausted = true;
            this.finished = true;
        }

        public int size() {
            return candidates.size();
        }

        private FetchResult complete() {
            return FetchResult.builder()
                    .candidates(List.copyOf(candidates))
                    .nextCursor(finished ? nextCursor : incomingCursor)
                    .exhausted(exhausted)
                    .dataErrors(dataErrors)
                    .build();
        }

        private FetchResult cancelled() {
            return FetchResult.builder()
                    .candidates(List.copyOf(candidates))
                    .nextCursor(incomingCursor)
                    .cancelled(true)
                    .dataErrors(dataErrors)
                    .build();
        }

        private FetchResult partial(boolean throttled, String error) {
            return FetchResult.builder()
                    .candidates(List.copyOf(candidates))
                    .nextCursor(incomingCursor)
                    .throttled(throttled)
                    .dataErrors(dataErrors)
                    .error(error)
                    .build();
        }
    }
}
