package com.storeradar.discovery.model;

public enum ValidationMode {
    /** Identity not in the store; accepted candidates become new records. */
    CREATE,
    /** Identity already stored and due; the record is revalidated in place. */
    REFRESH
}
