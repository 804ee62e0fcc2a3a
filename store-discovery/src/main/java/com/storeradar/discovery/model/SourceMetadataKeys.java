package com.storeradar.discovery.model;

/**
 * Keys adapters use in {@link Candidate#getSourceMetadata()}.
 */
public final class SourceMetadataKeys {

    public static final String RUNNING_ADS = "runningAds";
    public static final String PAGE_NAME = "pageName";
    public static final String PERMALINK = "permalink";
    public static final String SNIPPET = "snippet";
    public static final String CERT_ID = "certId";
    public static final String CAPTURED_AT = "capturedAt";

    private SourceMetadataKeys() {
    }
}
