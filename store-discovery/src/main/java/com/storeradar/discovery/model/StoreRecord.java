package com.storeradar.discovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A validated storefront. Stored in the stores table, keyed by identityUrl.
 * Created only after full validation; later passes refresh it, never delete it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StoreRecord {

    public static final String UNCLASSIFIED_TAG = "Unclassified";
    public static final String RUNNING_ADS_TAG = "Currently Running Ads";

    private String identityUrl;             // normalized https://host
    private String displayName;
    private String country;
    private String theme;
    private BusinessModel businessModel;    // null while unclassified
    private double businessModelConfidence;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private Integer productCount;
    @Builder.Default
    private boolean active = true;
    private Instant firstSeenAt;
    private Instant lastValidatedAt;
    private int retryCount;
    private Instant nextRetryAt;            // null = nothing scheduled
    private boolean tagsLocked;             // set by editors; freezes classification fields
    private String sourceName;              // adapter that first found it
    private int classificationAttempts;
    private boolean runningAds;

    public boolean isUnclassified() {
        return businessModel == null;
    }
}
