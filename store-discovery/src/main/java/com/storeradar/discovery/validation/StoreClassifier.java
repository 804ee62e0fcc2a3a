package com.storeradar.discovery.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.storeradar.discovery.model.BusinessModel;
import com.storeradar.discovery.model.Classification;
import com.storeradar.discovery.model.StoreRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Business model and tags.
 *
 * Below the confidence threshold the store is tagged Unclassified with no business model;
 * there is no fallback model. Records with locked tags are not reclassified.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoreClassifier implements ValidationStage {

    private final BusinessModelScorer scorer;

    @Override
    public String name() {
        return "classification";
    }

    @Override
    public StageResult apply(ValidationContext ctx) {
        StoreRecord existing = ctx.getExisting();
        if (existing != null && existing.isTagsLocked()) {
            log.debug("{} has locked tags, keeping classification", ctx.identityUrl());
            return StageResult.pass();
        }

        boolean runningAds = ctx.getCandidate().isRunningAds() || (existing != null && existing.isRunningAds());
        ctx.setClassification(classify(scoringInput(ctx), runningAds, ctx.getSettings().getConfidenceThreshold()));
        return StageResult.pass();
    }

    public Classification classify(BusinessModelScorer.ScoringInput input, boolean runningAds, double threshold) {
        Map<BusinessModel, Double> scores = scorer.score(input);

        BusinessModel best = null;
        double bestScore = 0.0;
        for (Map.Entry<BusinessModel, Double> e : scores.entrySet()) {
            if (e.getValue() > bestScore) {
                best = e.getKey();
                bestScore = e.getValue();
            }
        }

        List<String> tags = new ArrayList<>();
        BusinessModel chosen = bestScore >= threshold ? best : null;
        tags.add(chosen != null ? chosen.label() : StoreRecord.UNCLASSIFIED_TAG);
        if (runningAds) {
            tags.add(StoreRecord.RUNNING_ADS_TAG);
        }

        return Classification.builder()
                .businessModel(chosen)
                .confidence(bestScore)
                .scores(Map.copyOf(scores))
                .tags(List.copyOf(tags))
                .runningAds(runningAds)
                .build();
    }

    private static BusinessModelScorer.ScoringInput scoringInput(ValidationContext ctx) {
        String homepageText = ctx.document().text().toLowerCase(Locale.ROOT);

        List<String> productText = new ArrayList<>();
        ctx.productsPage(1).ifPresent(products -> {
            for (JsonNode p : products) {
                productText.add(String.join(" ",
                        p.path("title").asText(""),
                        p.path("product_type").asText(""),
                        p.path("vendor").asText(""),
                        p.path("tags").toString()).toLowerCase(Locale.ROOT));
            }
        });
        return new BusinessModelScorer.ScoringInput(ctx.identityUrl(), homepageText, productText);
    }
}
