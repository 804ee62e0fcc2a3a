package com.storeradar.discovery.error;

/**
 * One malformed upstream record. The record is skipped and counted.
 */
public class AdapterDataException extends RuntimeException {

    public AdapterDataException(String message) {
        super(message);
    }

    public AdapterDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
