package com.stockdesk.catalogsync.application.support;

import java.time.Duration;

/**
 * Blocking pause used between requests and batches. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
