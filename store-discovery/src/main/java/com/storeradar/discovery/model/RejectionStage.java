package com.storeradar.discovery.model;

public enum RejectionStage {
    INVALID_URL,
    PLATFORM,
    ACCESS_GATED,
    INACTIVE,
    ZERO_PRODUCTS
}
