package com.storeradar.discovery.error;

/**
 * Network, timeout or throttle failure talking to one discovery source.
 * Never aborts a run: the adapter converts it into a backoff and a partial result.
 */
public class AdapterTransportException extends RuntimeException {

    private final boolean throttled;

    public AdapterTransportException(String message, boolean throttled, Throwable cause) {
        super(message, cause);
        this.throttled = throttled;
    }

    public AdapterTransportException(String message, boolean throttled) {
        this(message, throttled, null);
    }

    public boolean isThrottled() {
        return throttled;
    }
}
