package com.storeradar.discovery.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class Classification {

    BusinessModel businessModel;        // null below the confidence threshold
    double confidence;
    Map<BusinessModel, Double> scores;
    List<String> tags;
    boolean runningAds;

    public boolean isConfident() {
        return businessModel != null;
    }
}
