package com.stockdesk.catalogsync.application;

import com.stockdesk.catalogsync.domain.model.SyncJob;

/**
 * Starts, observes and stops full catalog synchronizations, one per scope at a time.
 */
public interface SyncCatalog {

    /**
     * Starts a background sync for the scope.
     *
     * @param scopeKey     marketplace account to synchronize
     * @param forceRefresh when false and the last full sync is still fresh, pages are read from the local copy
     * @return the job in {@code PROCESSING} state
     * @throws com.stockdesk.catalogsync.domain.exception.UnknownScopeException if the scope has no configured account
     * @throws com.stockdesk.catalogsync.domain.exception.SyncAlreadyRunningException if a sync is already running
     */
    SyncJob startSync(String scopeKey, boolean forceRefresh);

    /**
     * @return the current or last job of the scope, {@code IDLE} if there is none
     */
    SyncJob getSyncProgress(String scopeKey);

    /**
     * Asks a running sync to stop after the page it is working on.
     *
     * @return true if a running sync was signalled
     */
    boolean cancelSync(String scopeKey);

    /**
     * Gives up on a running sync: its run is cancelled and the job fails immediately with {@code reason}.
     */
    void abandonSync(String scopeKey, String reason);
}
