package com.stockdesk.catalogsync.domain.exception;

public class SyncAlreadyRunningException extends RuntimeException {

    private final String scopeKey;

    public SyncAlreadyRunningException(String scopeKey) {
        super("Sync is already running for scope " + scopeKey);
        this.scopeKey = scopeKey;
    }

    public String getScopeKey() {
        return scopeKey;
    }
}
