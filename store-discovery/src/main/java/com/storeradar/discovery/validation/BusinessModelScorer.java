package com.storeradar.discovery.validation;

import com.storeradar.discovery.model.BusinessModel;

import java.util.List;
import java.util.Map;

/**
 * Pluggable business-model heuristic. Returns a confidence in [0, 1] per model;
 * the scores need not sum to 1.
 */
public interface BusinessModelScorer {

    Map<BusinessModel, Double> score(ScoringInput input);

    /**
     * @param homepageText visible homepage text, lower-cased
     * @param productText  titles, types, vendors and tags of the first products page, lower-cased
     */
    record ScoringInput(String identityUrl, String homepageText, List<String> productText) {}
}
