package com.storeradar.discovery.error;

/**
 * Network error, timeout, 429 or 5xx while probing a storefront.
 * The candidate is deferred with backoff, never rejected.
 */
public class TransientProbeException extends RuntimeException {

    private final boolean throttled;

    public TransientProbeException(String message) {
        this(message, false, null);
    }

    public TransientProbeException(String message, Throwable cause) {
        this(message, false, cause);
    }

    private TransientProbeException(String message, boolean throttled, Throwable cause) {
        super(message, cause);
        this.throttled = throttled;
    }

    /** The host answered 429. */
    public static TransientProbeException throttled(String message) {
        return new TransientProbeException(message, true, null);
    }

    public boolean isThrottled() {
        return throttled;
    }
}
