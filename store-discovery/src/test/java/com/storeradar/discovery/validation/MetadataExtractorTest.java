package com.storeradar.discovery.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.model.StoreMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void displayNamePrefersMetaJsonThenOpenGraphThenTitle() throws Exception {
        Document withOg = Jsoup.parse("<html><head><meta property=\"og:site_name\" content=\"Cool Mugs\">"
                + "<title>Home &ndash; Cool Mugs Co</title></head></html>");
        Document titleOnly = Jsoup.parse("<html><head><title>Cool Mugs - Home</title></head></html>");
        Document empty = Jsoup.parse("<html></html>");

        assertThat(MetadataExtractor.displayName(mapper.readTree("{\"name\":\" Mug HQ \"}"), withOg, "https://x.com"))
                .isEqualTo("Mug HQ");
        assertThat(MetadataExtractor.displayName(null, withOg, "https://x.com")).isEqualTo("Cool Mugs");
        assertThat(MetadataExtractor.displayName(null, titleOnly, "https://x.com")).isEqualTo("Cool Mugs");
        assertThat(MetadataExtractor.displayName(null, empty, "https://cool-mugs.myshopify.com")).isEqualTo("cool-mugs");
    }

    @Test
    void countryAndThemeDefaultToUnknown() throws Exception {
        assertThat(MetadataExtractor.country(mapper.readTree("{\"country\":\"US\"}"), "")).isEqualTo("US");
        assertThat(MetadataExtractor.country(null, "<script>Shopify.country = \"DE\";</script>")).isEqualTo("DE");
        assertThat(MetadataExtractor.country(null, "<html></html>")).isEqualTo(StoreMetadata.UNKNOWN);
        assertThat(MetadataExtractor.theme("Shopify.theme = {\"name\":\"Sense\",\"id\":9}")).isEqualTo("Sense");
        assertThat(MetadataExtractor.theme(null)).isEqualTo(StoreMetadata.UNKNOWN);
    }
}
