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
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.Map;

/**
 * Newest Reddit posts mentioning store links, via the public JSON listing search.
 * Cursor is the listing's {@code after} token.
 */
@Component
@Slf4j
public class RedditSearchAdapter extends AbstractSourceAdapter {

    public static final String NAME = "reddit";

    private static final String DEFAULT_BASE_URL = "https://www.reddit.com";
    private static final String DEFAULT_QUERY = "myshopify.com";

    public RedditSearchAdapter(RestTemplate restTemplate,
                               ObjectMapper objectMapper,
                               UrlTextScanner scanner,
                               DiscoveryProperties properties,
                               Clock clock,
                               Sleeper sleeper) {
        super(NAME, PriorityTier.FREE_FAST, restTemplate, objectMapper, scanner, properties, clock, sleeper);
    }

    @Override
    protected void fetchPage(String cursor, Page page) throws InterruptedException {
        String query = settings.getQueries().isEmpty() ? DEFAULT_QUERY : String.join(" OR ", settings.getQueries());

        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl(DEFAULT_BASE_URL) + "/search.json")
                .queryParam("q", query)
                .queryParam("sort", "new")
                .queryParam("type", "link")
                .queryParam("limit", Math.min(settings.getPageSize(), 100));
        if (cursor != null && !cursor.isBlank()) {
            builder.queryParam("after", cursor);
        }
        URI uri = builder.encode().build().toUri();

        JsonNode listing = getJson(uri).path("data");
        if (!listing.isObject() || !listing.path("children").isArray()) {
            throw new AdapterTransportException("Unexpected listing shape from Reddit", false);
        }

        for (JsonNode child : listing.path("children")) {
            JsonNode post = child.path("data");
            if (!post.isObject()) {
                page.dataError(child.toString());
                continue;
            }
            String text = String.join(" ",
                    post.path("url").asText(""),
                    post.path("title").asText(""),
                    post.path("selftext").asText(""));
            page.addAll(scanner.scan(text), Map.of(
                    SourceMetadataKeys.PERMALINK, post.path("permalink").asText("")));
        }

        String after = listing.path("after").asText(null);
        if (after == null || after.isBlank()) {
            page.exhausted(null);
        } else {
            page.advance(after);
        }
    }
}
