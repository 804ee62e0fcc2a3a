package com.storeradar.discovery.validation;

import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.error.TransientProbeException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * GETs against candidate storefronts.
 *
 * Uses java.net.http rather than RestTemplate: the checks need raw status codes, headers
 * and the post-redirect URI, not mapped objects. 5xx, 429, timeouts and I/O errors are
 * thrown as {@link TransientProbeException} after the storefrontProbe retries run out.
 */
@Component
@Slf4j
public class StorefrontHttpClient {

    private final HttpClient httpClient;
    private final Duration readTimeout;
    private final String userAgent;

    public StorefrontHttpClient(DiscoveryProperties properties) {
        DiscoveryProperties.Http http = properties.getHttp();
        this.readTimeout = http.getReadTimeout();
        this.userAgent = http.getUserAgent();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(http.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Retry(name = "storefrontProbe")
    public ProbeResponse get(String url) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(readTimeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/json;q=0.9,*/*;q=0.8")
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            log.debug("GET {} -> {}", url, status);

            if (status == 429) {
                throw TransientProbeException.throttled("HTTP 429 from " + url);
            }
            if (status >= 500) {
                throw new TransientProbeException("HTTP " + status + " from " + url);
            }
            return new ProbeResponse(status, response.headers().map(), response.body(), response.uri());

        } catch (HttpTimeoutException e) {
            throw new TransientProbeException("Timed out fetching " + url, e);
        } catch (IOException e) {
            throw new TransientProbeException("I/O error fetching " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientProbeException("Interrupted fetching " + url, e);
        }
    }
}
