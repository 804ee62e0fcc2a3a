package com.storeradar.discovery.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StoreMetadata {

    public static final String UNKNOWN = "Unknown";

    String displayName;
    String country;
    String theme;
    Integer productCount;       // null when the store does not expose its catalogue
}
