package com.storeradar.discovery.config;

import com.storeradar.discovery.ratelimit.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class DiscoveryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.untilCancelled();
    }

    /**
     * Shared client for source adapters. Retries and throttling are handled per adapter
     * by its rate limiter, so this client does neither.
     */
    @Bean
    public RestTemplate restTemplate(DiscoveryProperties properties) {
        DiscoveryProperties.Http http = properties.getHttp();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) http.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) http.getReadTimeout().toMillis());

        RestTemplate restTemplate = new RestTemplate(factory);
        restTemplate.getInterceptors().add((request, body, execution) -> {
            request.getHeaders().set(HttpHeaders.USER_AGENT, http.getUserAgent());
            return execution.execute(request, body);
        });
        return restTemplate;
    }
}
