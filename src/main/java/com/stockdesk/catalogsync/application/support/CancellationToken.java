package com.stockdesk.catalogsync.application.support;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between whoever starts a piece of work and the code running it.
 * Checked at every suspension point: before each queued attempt and before each page request.
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel(String why) {
        return reason.compareAndSet(null, why != null ? why : "cancelled");
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
