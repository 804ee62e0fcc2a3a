package com.storeradar.discovery.error;

/**
 * Raised before any adapter runs when a run cannot start at all,
 * e.g. the store repository is unreachable. The only error that reaches the run caller.
 */
public class FatalConfigurationException extends RuntimeException {

    public FatalConfigurationException(String message) {
        super(message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
