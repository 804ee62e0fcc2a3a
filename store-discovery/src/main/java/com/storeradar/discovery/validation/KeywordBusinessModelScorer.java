package com.storeradar.discovery.validation;

import com.storeradar.discovery.model.BusinessModel;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Default scorer: counts marker phrases per model and turns the counts into shares.
 *
 * A model's confidence is {@code hits / (allHits + 1)}, so a single stray keyword never
 * reaches a 0.7 threshold and conflicting evidence drags every model down.
 */
@Component
public class KeywordBusinessModelScorer implements BusinessModelScorer {

    private static final Map<BusinessModel, List<String>> MARKERS = Map.of(
            BusinessModel.PRINT_ON_DEMAND, List.of(
                    "print on demand", "printful", "printify", "gelato", "teespring",
                    "custom printed", "personalized", "personalised", "design your own"),
            BusinessModel.DROPSHIPPING, List.of(
                    "dsers", "oberlo", "aliexpress", "cj dropshipping", "zendrop", "spocket",
                    "7-15 business days", "10-20 business days", "ships from overseas", "tracking number will be"),
            BusinessModel.BRANDED_ECOMMERCE, List.of(
                    "our story", "handmade", "handcrafted", "designed in", "founded in",
                    "our mission", "small batch", "family owned"),
            BusinessModel.MARKETPLACE, List.of(
                    "multi-vendor", "multivendor", "become a seller", "sell with us",
                    "our vendors", "marketplace", "independent sellers")
    );

    @Override
    public Map<BusinessModel, Double> score(ScoringInput input) {
        String haystack = input.homepageText() + "\n" + String.join("\n", input.productText());

        Map<BusinessModel, Integer> hits = new EnumMap<>(BusinessModel.class);
        int allHits = 0;
        for (Map.Entry<BusinessModel, List<String>> e : MARKERS.entrySet()) {
            int count = 0;
            for (String marker : e.getValue()) {
                if (haystack.contains(marker)) count++;
            }
            hits.put(e.getKey(), count);
            allHits += count;
        }

        Map<BusinessModel, Double> scores = new EnumMap<>(BusinessModel.class);
        for (BusinessModel model : BusinessModel.values()) {
            scores.put(model, hits.getOrDefault(model, 0) / (double) (allHits + 1));
        }
        return scores;
    }
}
