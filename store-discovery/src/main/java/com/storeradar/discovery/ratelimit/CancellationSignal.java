package com.storeradar.discovery.ratelimit;

import java.time.Duration;

/**
 * Cancellation of the run a request belongs to, observable from a blocking wait.
 */
public interface CancellationSignal {

    /** For calls made outside a run: never cancelled, waits are plain sleeps. */
    CancellationSignal NEVER = new CancellationSignal() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public boolean await(Duration timeout) throws InterruptedException {
            Thread.sleep(timeout.toMillis());
            return false;
        }
    };

    boolean isCancelled();

    /**
     * Blocks for up to {@code timeout}, returning early once cancelled.
     *
     * @return true if cancelled
     */
    boolean await(Duration timeout) throws InterruptedException;
}
