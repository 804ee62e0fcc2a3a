package com.storeradar.discovery.event;

import com.storeradar.discovery.model.StoreRecord;

/**
 * @param created true for a new record, false for a refresh
 */
public record StoreAcceptedEvent(String runId, StoreRecord record, boolean created) {}
