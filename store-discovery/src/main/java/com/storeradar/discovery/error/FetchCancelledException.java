package com.storeradar.discovery.error;

/**
 * The run was cancelled while a source was waiting for its next request slot.
 */
public class FetchCancelledException extends RuntimeException {

    public FetchCancelledException(String sourceName) {
        super(sourceName + ": run cancelled before the next request");
    }
}
