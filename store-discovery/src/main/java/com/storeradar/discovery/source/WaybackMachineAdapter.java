package com.storeradar.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Archived {@code myshopify.com} URLs from the Internet Archive CDX API.
 *
 * Response shape with {@code output=json&showResumeKey=true}:
 * <pre>
 *   [["original","timestamp"],
 *    ["https://a.myshopify.com/","20240101000000"],
 *    ...,
 *    [],
 *    ["resume-key"]]
 * </pre>
 * The first row is the header; the trailing resume key is the cursor.
 */
@Component
@Slf4j
public class WaybackMachineAdapter extends AbstractSourceAdapter {

    public static final String NAME = "wayback-machine";

    private static final String DEFAULT_BASE_URL = "https://web.archive.org";

    private static final JsonNode DEFAULT_HEADER = JsonNodeFactory.instance.arrayNode()
            .add("original")
            .add("timestamp");

    public WaybackMachineAdapter(RestTemplate restTemplate,
                                 ObjectMapper objectMapper,
                                 UrlTextScanner scanner,
                                 DiscoveryProperties properties,
                                 Clock clock,
                                 Sleeper sleeper) {
        super(NAME, PriorityTier.FREE_SLOW, restTemplate, objectMapper, scanner, properties, clock, sleeper);
    }

    @Override
    protected void fetchPage(String cursor, Page page) throws InterruptedException {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl(DEFAULT_BASE_URL) + "/cdx/search/cdx")
                .queryParam("url", "myshopify.com")
                .queryParam("matchType", "domain")
                .queryParam("output", "json")
                .queryParam("fl", "original,timestamp")
                .queryParam("collapse", "urlkey")
                .queryParam("limit", settings.getPageSize())
                .queryParam("showResumeKey", "true");
        if (cursor != null && !cursor.isBlank()) {
            builder.queryParam("resumeKey", cursor);
        }
        URI uri = builder.encode().build().toUri();

        JsonNode root = getJson(uri);
        if (!root.isArray()) {
            throw new AdapterTransportException("CDX API returned a non-array body", false);
        }
        if (root.isEmpty()) {
            page.exhausted(null);
            return;
        }

        JsonNode header = root.get(0);
        if (!header.isArray()) {
            page.dataError("header " + header);
            header = DEFAULT_HEADER;
        }
        int urlColumn = columnOf(header, "original", 0);
        int timeColumn = columnOf(header, "timestamp", 1);

        Map<String, String> hosts = new LinkedHashMap<>();
        String resumeKey = null;
        boolean pastBlank = false;

        for (int i = 1; i < root.size(); i++) {
            JsonNode row = root.get(i);
            if (!row.isArray()) {
                page.dataError(row.toString());
                continue;
            }
            if (row.isEmpty()) {
                pastBlank = true;
                continue;
            }
            if (pastBlank) {
                resumeKey = row.get(0).asText(null);
                continue;
            }
            if (row.size() != header.size()) {
                page.dataError(row.toString());
                continue;
            }
            String timestamp = row.path(timeColumn).asText("");
            for (String url : scanner.scan(row.path(urlColumn).asText(""))) {
                hosts.putIfAbsent(url, timestamp);
            }
        }

        hosts.forEach((url, ts) -> page.add(url, Map.of(SourceMetadataKeys.CAPTURED_AT, ts)));

        if (resumeKey != null && !resumeKey.isBlank()) {
            page.advance(resumeKey);
        } else {
            page.exhausted(null);
        }
    }

    private static int columnOf(JsonNode header, String name, int fallback) {
        for (int i = 0; i < header.size(); i++) {
            if (name.equals(header.get(i).asText())) return i;
        }
        return fallback;
    }
}
