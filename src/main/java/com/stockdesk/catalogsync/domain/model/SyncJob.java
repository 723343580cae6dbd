package com.stockdesk.catalogsync.domain.model;

import java.time.Instant;

/**
 * Read-only snapshot of one sync run for a scope (marketplace account).
 */
public record SyncJob(
        String scopeKey,
        SyncStatus status,
        SyncProgress progress,
        SyncResult result,
        String error,
        Instant startedAt,
        Instant updatedAt,
        Instant finishedAt
) {
    public static SyncJob idle(String scopeKey) {
        return new SyncJob(scopeKey, SyncStatus.IDLE, new SyncProgress(0, 0, null),
                null, null, null, null, null);
    }

    public boolean isProcessing() {
        return status == SyncStatus.PROCESSING;
    }
}
