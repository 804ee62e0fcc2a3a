package com.storeradar.discovery.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.error.TransientProbeException;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.support.MutableClock;
import com.storeradar.discovery.validation.ProbeResponse;
import com.storeradar.discovery.validation.StorefrontHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FingerprintProbeAdapterTest {

    @Mock
    private RestTemplate restTemplate;

    @Mock
    private StorefrontHttpClient storefrontClient;

    private MutableClock clock;
    private List<Duration> sleeps;
    private FingerprintProbeAdapter adapter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-10T12:00:00Z");
        sleeps = new ArrayList<>();
        DiscoveryProperties properties = new DiscoveryProperties();
        DiscoveryProperties.Source source = new DiscoveryProperties.Source();
        source.setFeedUrl("https://feeds.example.org/new-domains.txt");
        source.setMinDelay(Duration.ofMillis(200));
        source.setPageSize(50);
        properties.getSources().put(FingerprintProbeAdapter.NAME, source);
        adapter = new FingerprintProbeAdapter(restTemplate, new ObjectMapper(), new UrlTextScanner(), properties, clock,
                (d, signal) -> {
                    sleeps.add(d);
                    clock.advance(d);
                    return false;
                },
                storefrontClient);
    }

    private static ProbeResponse response(Map<String, List<String>> headers, String body) {
        return new ProbeResponse(200, headers, body, URI.create("https://example.org/"));
    }

    @Test
    @DisplayName("each homepage probe waits its turn behind the source's minimum delay")
    void probesArePaced() {
        // given
        when(restTemplate.getForObject(any(URI.class), eq(String.class)))
                .thenReturn("alpha-store.com\n# registered today\nbeta-goods.com\ngamma-things.com\n");
        when(storefrontClient.get(anyString())).thenAnswer(inv -> {
            String url = inv.getArgument(0);
            if (url.contains("alpha-store")) return response(Map.of("X-ShopId", List.of("123")), "");
            if (url.contains("beta-goods")) return response(Map.of(), "<script src=\"//cdn.shopify.com/s/x.js\">");
            throw new TransientProbeException("HTTP 502 from " + url);
        });

        // when
        FetchResult result = adapter.fetch(null);

        // then
        assertThat(result.getCandidates()).extracting(Candidate::getRawUrl)
                .hasSize(2)
                .anySatisfy(url -> assertThat(url).contains("alpha-store.com"))
                .anySatisfy(url -> assertThat(url).contains("beta-goods.com"));
        assertThat(result.isThrottled()).isFalse();
        assertThat(result.isExhausted()).isTrue();
        assertThat(sleeps).containsExactly(Duration.ofMillis(200), Duration.ofMillis(200), Duration.ofMillis(200));
        verify(storefrontClient, times(3)).get(anyString());
    }

    @Test
    @DisplayName("a 429 from a probed host throttles the source and keeps the cursor")
    void throttledProbeBacksOffSource() {
        // given
        when(restTemplate.getForObject(any(URI.class), eq(String.class)))
                .thenReturn("alpha-store.com\nbeta-goods.com\n");
        when(storefrontClient.get(anyString()))
                .thenThrow(TransientProbeException.throttled("HTTP 429 from https://alpha-store.com/"));

        // when
        FetchResult result = adapter.fetch("0");

        // then
        assertThat(result.isThrottled()).isTrue();
        assertThat(result.getNextCursor()).isEqualTo("0");
        assertThat(result.getCandidates()).isEmpty();
        assertThat(adapter.rateLimiter().isBackingOff()).isTrue();
        assertThat(adapter.rateLimiter().currentBackoff()).isEqualTo(Duration.ofMinutes(1));
        verify(storefrontClient, times(1)).get(anyString());
    }
}
