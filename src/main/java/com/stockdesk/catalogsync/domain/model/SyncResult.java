package com.stockdesk.catalogsync.domain.model;

/**
 * Summary of a finished sync run.
 * {@code partial} is set when the run stopped before the end of the catalog; {@code stopReason} says why.
 */
public record SyncResult(
        int syncedCount,
        int totalCount,
        long durationSeconds,
        int errorCount,
        boolean partial,
        String stopReason
) {}
