package com.storeradar.discovery.validation;

import com.storeradar.discovery.model.BusinessModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KeywordBusinessModelScorerTest {

    private final KeywordBusinessModelScorer scorer = new KeywordBusinessModelScorer();

    @Test
    void consistentEvidenceScoresHigh() {
        Map<BusinessModel, Double> scores = scorer.score(new BusinessModelScorer.ScoringInput(
                "https://dropstore.com",
                "free shipping worldwide. delivery takes 7-15 business days.",
                List.of("led lamp aliexpress", "phone case cj dropshipping")));

        assertThat(scores.get(BusinessModel.DROPSHIPPING)).isCloseTo(0.75, within(1e-9));
        assertThat(scores.get(BusinessModel.MARKETPLACE)).isZero();
    }

    @Test
    void singleKeywordStaysBelowThreshold() {
        Map<BusinessModel, Double> scores = scorer.score(new BusinessModelScorer.ScoringInput(
                "https://shop.com", "our story begins here", List.of()));

        assertThat(scores.get(BusinessModel.BRANDED_ECOMMERCE)).isEqualTo(0.5);
    }

    @Test
    void conflictingEvidenceDragsEveryModelDown() {
        Map<BusinessModel, Double> scores = scorer.score(new BusinessModelScorer.ScoringInput(
                "https://mixed.com", "printful handmade marketplace aliexpress", List.of()));

        assertThat(scores.values()).allSatisfy(s -> assertThat(s).isEqualTo(0.2));
    }
}
