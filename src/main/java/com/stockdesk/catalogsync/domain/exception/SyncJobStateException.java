package com.stockdesk.catalogsync.domain.exception;

/**
 * A terminal transition was requested for a job that is not processing.
 */
public class SyncJobStateException extends IllegalStateException {

    public SyncJobStateException(String message) {
        super(message);
    }
}
