package com.storeradar.discovery.store;

public enum UpsertResult {
    CREATED, REFRESHED
}
