package com.storeradar.discovery.ratelimit;

import java.time.Duration;

/**
 * Blocking pause between requests. Swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @return true if the pause ended early because {@code signal} fired
     */
    boolean sleep(Duration duration, CancellationSignal signal) throws InterruptedException;

    static Sleeper untilCancelled() {
        return (duration, signal) -> {
            if (duration.isNegative() || duration.isZero()) return signal.isCancelled();
            return signal.await(duration);
        };
    }
}
