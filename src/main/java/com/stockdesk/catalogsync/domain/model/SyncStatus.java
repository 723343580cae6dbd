package com.stockdesk.catalogsync.domain.model;

public enum SyncStatus {
    IDLE,
    PROCESSING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
