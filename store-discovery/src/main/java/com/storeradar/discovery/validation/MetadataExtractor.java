package com.storeradar.discovery.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.storeradar.discovery.error.TransientProbeException;
import com.storeradar.discovery.model.StoreMetadata;
import com.storeradar.discovery.normalize.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Display name, country, theme and product count.
 *
 * /meta.json and the product count run concurrently on the probe pool; name, country and
 * theme fall back to the already fetched homepage. Product count has no fallback: if the
 * count probe fails transiently the candidate is deferred, if the store does not expose
 * its catalogue the count stays null and the acceptance gate rejects it.
 */
@Component
@Slf4j
public class MetadataExtractor implements ValidationStage {

    private static final Pattern SHOPIFY_COUNTRY = Pattern.compile("Shopify\\.country\\s*=\\s*\"([A-Z]{2})\"");
    private static final Pattern SHOPIFY_THEME = Pattern.compile(
            "Shopify\\.theme\\s*=\\s*\\{[^}]*?\"name\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern TITLE_SEPARATOR = Pattern.compile("\\s+[|\u2013\u2014-]\\s+");

    private final Executor probeExecutor;

    public MetadataExtractor(@Qualifier("probeExecutor") Executor probeExecutor) {
        this.probeExecutor = probeExecutor;
    }

    @Override
    public String name() {
        return "metadata";
    }

    @Override
    public StageResult apply(ValidationContext ctx) {
        Duration timeout = ctx.getSettings().getValidationTimeout();
        int maxPages = ctx.getSettings().getMaxProductPages();

        CompletableFuture<Optional<JsonNode>> meta = CompletableFuture.supplyAsync(() -> fetchMeta(ctx), probeExecutor);
        CompletableFuture<Integer> count = CompletableFuture.supplyAsync(() -> countProducts(ctx, maxPages), probeExecutor);

        Integer productCount;
        try {
            productCount = count.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            meta.cancel(true);
            if (e.getCause() instanceof TransientProbeException) {
                return StageResult.defer("product count probe failed: " + e.getCause().getMessage());
            }
            throw new IllegalStateException("Product count failed for " + ctx.identityUrl(), e.getCause());
        } catch (TimeoutException e) {
            count.cancel(true);
            meta.cancel(true);
            return StageResult.defer("product count probe timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StageResult.defer("interrupted");
        }

        JsonNode metaJson = meta.completeOnTimeout(Optional.empty(), timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(t -> Optional.empty())
                .join()
                .orElse(null);

        Document doc = ctx.document();
        ctx.setMetadata(StoreMetadata.builder()
                .displayName(displayName(metaJson, doc, ctx.identityUrl()))
                .country(country(metaJson, ctx.homepage().body()))
                .theme(theme(ctx.homepage().body()))
                .productCount(productCount)
                .build());
        return StageResult.pass();
    }

    // ── Probes ───────────────────────────────────────────────────────────────

    private Optional<JsonNode> fetchMeta(ValidationContext ctx) {
        try {
            ProbeResponse response = ctx.probe("/meta.json");
            return response.isOk() ? ctx.parseJson(response.body()) : Optional.empty();
        } catch (TransientProbeException e) {
            log.debug("meta.json unavailable for {}: {}", ctx.identityUrl(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Products across up to {@code maxPages} pages; null when /products.json is not served.
     */
    static Integer countProducts(ValidationContext ctx, int maxPages) {
        int total = 0;
        for (int page = 1; page <= Math.max(1, maxPages); page++) {
            Optional<JsonNode> products = ctx.productsPage(page);
            if (products.isEmpty()) {
                return page == 1 ? null : total;
            }
            int size = products.get().size();
            total += size;
            if (size < ValidationContext.PRODUCTS_PAGE_SIZE) break;
        }
        return total;
    }

    // ── Field extraction ─────────────────────────────────────────────────────

    static String displayName(JsonNode meta, Document doc, String identityUrl) {
        if (meta != null && !meta.path("name").asText("").isBlank()) {
            return meta.path("name").asText().trim();
        }
        Element ogName = doc.selectFirst("meta[property=og:site_name]");
        if (ogName != null && !ogName.attr("content").isBlank()) {
            return ogName.attr("content").trim();
        }
        String title = doc.title();
        if (!title.isBlank()) {
            return TITLE_SEPARATOR.split(title, 2)[0].trim();
        }
        Element h1 = doc.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) {
            return h1.text().trim();
        }
        return hostName(identityUrl);
    }

    static String country(JsonNode meta, String html) {
        if (meta != null && !meta.path("country").asText("").isBlank()) {
            return meta.path("country").asText().trim();
        }
        Matcher m = SHOPIFY_COUNTRY.matcher(html == null ? "" : html);
        return m.find() ? m.group(1) : StoreMetadata.UNKNOWN;
    }

    static String theme(String html) {
        Matcher m = SHOPIFY_THEME.matcher(html == null ? "" : html);
        return m.find() ? m.group(1) : StoreMetadata.UNKNOWN;
    }

    static String hostName(String identityUrl) {
        String host = UrlNormalizer.hostOf(identityUrl);
        return host.endsWith(".myshopify.com")
                ? host.substring(0, host.length() - ".myshopify.com".length())
                : host;
    }
}
