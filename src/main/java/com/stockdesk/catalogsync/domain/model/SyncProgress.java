package com.stockdesk.catalogsync.domain.model;

public record SyncProgress(
        int current,
        int total,
        String stage
) {
    public static SyncProgress starting() {
        return new SyncProgress(0, 0, "Starting");
    }

    public SyncProgress withCurrentAtLeast(int floor) {
        return current >= floor ? this : new SyncProgress(floor, total, stage);
    }
}
