package com.storeradar.discovery.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GoogleCustomSearchAdapterTest {

    @Mock
    private RestTemplate restTemplate;

    private DiscoveryProperties properties;
    private DiscoveryProperties.Source source;

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
        source = new DiscoveryProperties.Source();
        source.setApiKey("key");
        source.setSearchEngineId("cx");
        source.setQueries(List.of("site:myshopify.com", "\"powered by shopify\""));
        properties.getSources().put(GoogleCustomSearchAdapter.NAME, source);
    }

    private GoogleCustomSearchAdapter adapter() {
        return new GoogleCustomSearchAdapter(restTemplate, new ObjectMapper(), new UrlTextScanner(),
                properties, MutableClock.at("2024-05-10T12:00:00Z"), (d, signal) -> false);
    }

    private static String items(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "{\"link\": \"https://store-" + i + ".myshopify.com/\", \"displayLink\": \"store-" + i
                        + ".myshopify.com\", \"snippet\": \"new arrivals\"}")
                .collect(Collectors.joining(",", "{\"items\": [", "]}"));
    }

    @Test
    void needsKeyAndEngineId() {
        assertThat(adapter().isConfigured()).isTrue();
        source.setSearchEngineId(" ");
        assertThat(adapter().isConfigured()).isFalse();
    }

    @Test
    void fullPageAdvancesStart() {
        when(restTemplate.getForObject(any(URI.class), eq(String.class))).thenReturn(items(10));

        FetchResult result = adapter().fetch(null);

        assertThat(result.getCandidates()).hasSize(10);
        assertThat(result.getNextCursor()).isEqualTo("0:11");
        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(restTemplate).getForObject(uri.capture(), eq(String.class));
        assertThat(uri.getValue().getQuery()).contains("start=1").contains("num=10").contains("cx=cx");
    }

    @Test
    void startNeverPassesNinetyOne() {
        when(restTemplate.getForObject(any(URI.class), eq(String.class))).thenReturn(items(10));

        FetchResult result = adapter().fetch("0:91");

        assertThat(result.getNextCursor()).isEqualTo("1:1");
        assertThat(result.isExhausted()).isFalse();
    }

    @Test
    void shortPageOnLastQueryExhausts() {
        when(restTemplate.getForObject(any(URI.class), eq(String.class))).thenReturn(items(3));

        FetchResult result = adapter().fetch("1:21");

        assertThat(result.getCandidates()).extracting(Candidate::getRawUrl).hasSize(3);
        assertThat(result.isExhausted()).isTrue();
        assertThat(result.getNextCursor()).isNull();
    }

    @Test
    void outOfRangeCursorStartsOver() {
        when(restTemplate.getForObject(any(URI.class), eq(String.class))).thenReturn(items(0));

        adapter().fetch("7:500");

        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(restTemplate).getForObject(uri.capture(), eq(String.class));
        assertThat(uri.getValue().getQuery()).contains("start=1").contains("q=site:myshopify.com");
    }
}
