package com.storeradar.discovery.validation;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A storefront response the pipeline can reason about: 2xx-4xx only, 5xx and timeouts
 * surface as {@link com.storeradar.discovery.error.TransientProbeException}.
 *
 * @param finalUri the URI after redirects
 */
public record ProbeResponse(int status, Map<String, List<String>> headers, String body, URI finalUri) {

    public boolean isOk() {
        return status >= 200 && status < 300;
    }

    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }

    public String finalPath() {
        return finalUri == null || finalUri.getPath() == null ? "" : finalUri.getPath();
    }
}
