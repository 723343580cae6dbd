package com.stockdesk.catalogsync.application.support;

import java.time.Duration;

/**
 * Delay before the n-th retry: {@code initialDelay * 2^n}.
 */
public final class ExponentialBackoff {

    private static final int MAX_SHIFT = 30;

    private final Duration initialDelay;

    public ExponentialBackoff(Duration initialDelay) {
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be zero or positive");
        }
        this.initialDelay = initialDelay;
    }

    public Duration delayFor(int retry) {
        if (retry < 0) {
            throw new IllegalArgumentException("retry must be non-negative");
        }
        long factor = 1L << Math.min(retry, MAX_SHIFT);
        try {
            return Duration.ofMillis(Math.multiplyExact(initialDelay.toMillis(), factor));
        } catch (ArithmeticException e) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
    }
}
