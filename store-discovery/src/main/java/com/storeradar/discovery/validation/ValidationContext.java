package com.storeradar.discovery.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.RunSettings;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.model.Classification;
import com.storeradar.discovery.model.StoreMetadata;
import com.storeradar.discovery.model.StoreRecord;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.Optional;

/**
 * Per-candidate working state shared by the stages. Responses are cached so the
 * homepage and the first products page are fetched at most once.
 */
@Slf4j
public class ValidationContext {

    public static final int PRODUCTS_PAGE_SIZE = 250;

    @Getter
    private final Candidate candidate;
    @Getter
    private final StoreRecord existing;         // null in create mode
    @Getter
    private final RunSettings settings;

    private final StorefrontHttpClient client;
    private final ObjectMapper objectMapper;

    private volatile ProbeResponse homepage;
    private volatile Document document;
    private volatile Optional<JsonNode> firstProductsPage;

    @Getter @Setter
    private StoreMetadata metadata;
    @Getter @Setter
    private Classification classification;

    public ValidationContext(Candidate candidate,
                             StoreRecord existing,
                             RunSettings settings,
                             StorefrontHttpClient client,
                             ObjectMapper objectMapper) {
        this.candidate = candidate;
        this.existing = existing;
        this.settings = settings;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    public String identityUrl() {
        return candidate.getNormalizedUrl();
    }

    public ProbeResponse homepage() {
        if (homepage == null) {
            homepage = client.get(identityUrl() + "/");
        }
        return homepage;
    }

    public Document document() {
        if (document == null) {
            ProbeResponse home = homepage();
            document = Jsoup.parse(home.body() == null ? "" : home.body(), identityUrl());
        }
        return document;
    }

    public ProbeResponse probe(String path) {
        return client.get(identityUrl() + path);
    }

    /**
     * The {@code products} array of one /products.json page, or empty when the store
     * does not serve its catalogue as JSON.
     */
    public Optional<JsonNode> productsPage(int page) {
        if (page == 1 && firstProductsPage != null) {
            return firstProductsPage;
        }
        ProbeResponse response = probe("/products.json?limit=" + PRODUCTS_PAGE_SIZE + "&page=" + page);
        Optional<JsonNode> products = response.isOk() ? parseJson(response.body())
                .map(root -> root.get("products"))
                .filter(JsonNode::isArray) : Optional.empty();
        if (page == 1) {
            firstProductsPage = products;
        }
        return products;
    }

    public Optional<JsonNode> parseJson(String body) {
        if (body == null || body.isBlank()) return Optional.empty();
        try {
            return Optional.ofNullable(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            log.debug("Not JSON from {}: {}", identityUrl(), e.getMessage());
            return Optional.empty();
        }
    }
}
