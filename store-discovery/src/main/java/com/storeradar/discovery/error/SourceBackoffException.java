package com.storeradar.discovery.error;

import java.time.Instant;

/**
 * A source is inside its backoff window (request quota used up, or throttled earlier),
 * so no request was sent. Unlike a fresh throttle this does not lengthen the backoff.
 */
public class SourceBackoffException extends AdapterTransportException {

    private final Instant backoffUntil;

    public SourceBackoffException(String sourceName, Instant backoffUntil) {
        super(sourceName + " is backing off until " + backoffUntil, true);
        this.backoffUntil = backoffUntil;
    }

    public Instant getBackoffUntil() {
        return backoffUntil;
    }
}
