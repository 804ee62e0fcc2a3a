package com.storeradar.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.error.AdapterTransportException;
import com.storeradar.discovery.model.PriorityTier;
import com.storeradar.discovery.model.SourceMetadataKeys;
import com.storeradar.discovery.ratelimit.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Active ads linking to storefronts, from the Meta Ad Library API.
 *
 * Needs an access token. Every store found here is tagged as currently running ads.
 * Cursor is {@code paging.cursors.after}.
 */
@Component
@Slf4j
public class MetaAdLibraryAdapter extends AbstractSourceAdapter {

    public static final String NAME = "meta-ad-library";

    private static final String DEFAULT_BASE_URL = "https://graph.facebook.com/v19.0";
    private static final String DEFAULT_QUERY = "myshopify";
    private static final String FIELDS = "page_name,ad_creative_link_captions,ad_creative_bodies,ad_creative_link_titles";

    /** Graph API error codes meaning "rate limited" (app, user, page and custom limits). */
    private static final Set<Integer> THROTTLE_CODES = Set.of(4, 17, 32, 613);

    public MetaAdLibraryAdapter(RestTemplate restTemplate,
                                ObjectMapper objectMapper,
                                UrlTextScanner scanner,
                                DiscoveryProperties properties,
                                Clock clock,
                                Sleeper sleeper) {
        super(NAME, PriorityTier.QUOTA_LIMITED, restTemplate, objectMapper, scanner, properties, clock, sleeper);
    }

    @Override
    public boolean isConfigured() {
        return settings.getAccessToken() != null && !settings.getAccessToken().isBlank();
    }

    @Override
    protected void fetchPage(String cursor, Page page) throws InterruptedException {
        String query = settings.getQueries().isEmpty() ? DEFAULT_QUERY : settings.getQueries().get(0);

        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl(DEFAULT_BASE_URL) + "/ads_archive")
                .queryParam("access_token", settings.getAccessToken())
                .queryParam("search_terms", query)
                .queryParam("ad_type", "ALL")
                .queryParam("ad_active_status", "ACTIVE")
                .queryParam("ad_reached_countries", "[\"US\",\"GB\",\"CA\",\"AU\"]")
                .queryParam("fields", FIELDS)
                .queryParam("limit", settings.getPageSize());
        if (cursor != null && !cursor.isBlank()) {
            builder.queryParam("after", cursor);
        }
        URI uri = builder.encode().build().toUri();

        JsonNode root;
        try {
            root = getJson(uri);
        } catch (HttpClientErrorException.BadRequest e) {
            int code = errorCode(e.getResponseBodyAsString());
            if (THROTTLE_CODES.contains(code)) {
                throw new AdapterTransportException("Ad Library rate limit (code " + code + ")", true, e);
            }
            throw e;
        }

        JsonNode ads = root.path("data");
        if (!ads.isArray()) {
            throw new AdapterTransportException("Ad Library response has no data array", false);
        }

        for (JsonNode ad : ads) {
            if (!ad.isObject()) {
                page.dataError(ad.toString());
                continue;
            }
            Set<String> urls = new LinkedHashSet<>();
            for (JsonNode caption : ad.path("ad_creative_link_captions")) {
                scanner.fromDomain(caption.asText()).ifPresent(urls::add);
            }
            for (JsonNode body : ad.path("ad_creative_bodies")) {
                urls.addAll(scanner.scan(body.asText()));
            }
            String pageName = ad.path("page_name").asText("");
            urls.forEach(url -> page.add(url, Map.of(
                    SourceMetadataKeys.RUNNING_ADS, "true",
                    SourceMetadataKeys.PAGE_NAME, pageName)));
        }

        JsonNode paging = root.path("paging");
        String after = paging.path("cursors").path("after").asText(null);
        if (paging.hasNonNull("next") && after != null && !after.isBlank()) {
            page.advance(after);
        } else {
            page.exhausted(null);
        }
    }

    private int errorCode(String body) {
        try {
            return objectMapper.readTree(body).path("error").path("code").asInt(-1);
        } catch (Exception e) {
            log.debug("[{}] unreadable error body: {}", NAME, e.getMessage());
            return -1;
        }
    }
}
