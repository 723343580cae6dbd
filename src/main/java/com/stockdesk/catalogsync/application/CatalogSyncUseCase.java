package com.stockdesk.catalogsync.application;

import com.stockdesk.catalogsync.application.fetch.CatalogFetcher;
import com.stockdesk.catalogsync.application.fetch.FetchOutcome;
import com.stockdesk.catalogsync.application.fetch.FetchResult;
import com.stockdesk.catalogsync.application.progress.SyncProgressTracker;
import com.stockdesk.catalogsync.application.support.CancellationToken;
import com.stockdesk.catalogsync.domain.exception.SyncJobStateException;
import com.stockdesk.catalogsync.domain.model.SyncJob;
import com.stockdesk.catalogsync.domain.model.SyncProgress;
import com.stockdesk.catalogsync.domain.model.SyncResult;
import com.stockdesk.catalogsync.domain.model.SyncStatus;
import com.stockdesk.catalogsync.domain.port.out.CatalogStore;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClient;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClientProvider;
import com.stockdesk.catalogsync.domain.port.out.SyncMetadataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Service
public class CatalogSyncUseCase implements SyncCatalog {

    private static final Logger logger = LoggerFactory.getLogger(CatalogSyncUseCase.class);

    private final MarketplaceClientProvider clientProvider;
    private final CatalogStore catalogStore;
    private final SyncMetadataService syncMetadata;
    private final CatalogFetcher catalogFetcher;
    private final SyncProgressTracker progressTracker;
    private final Executor syncExecutor;
    private final Clock clock;

    // cancellation token of the run currently owning each scope
    private final Map<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    public CatalogSyncUseCase(MarketplaceClientProvider clientProvider,
                              CatalogStore catalogStore,
                              SyncMetadataService syncMetadata,
                              CatalogFetcher catalogFetcher,
                              SyncProgressTracker progressTracker,
                              @Qualifier("syncExecutor") Executor syncExecutor,
                              Clock clock) {
        this.clientProvider = clientProvider;
        this.catalogStore = catalogStore;
        this.syncMetadata = syncMetadata;
        this.catalogFetcher = catalogFetcher;
        this.progressTracker = progressTracker;
        this.syncExecutor = syncExecutor;
        this.clock = clock;
    }

    @Override
    public SyncJob startSync(String scopeKey, boolean forceRefresh) {
        MarketplaceClient client = clientProvider.forScope(scopeKey);
        SyncJob job = progressTracker.start(scopeKey);

        CancellationToken token = new CancellationToken();
        activeRuns.put(scopeKey, token);
        syncMetadata.updateSyncStatus(scopeKey, SyncStatus.PROCESSING.name());

        try {
            syncExecutor.execute(() -> runSync(scopeKey, client, forceRefresh, token));
        } catch (RejectedExecutionException e) {
            logger.error("Could not schedule sync for scope {}", scopeKey, e);
            activeRuns.remove(scopeKey, token);
            failJob(scopeKey, "Sync could not be scheduled: " + e.getMessage());
            return progressTracker.get(scopeKey);
        }

        logger.info("Catalog sync scheduled for scope {} (forceRefresh={})", scopeKey, forceRefresh);
        return job;
    }

    @Override
    public SyncJob getSyncProgress(String scopeKey) {
        return progressTracker.get(scopeKey);
    }

    @Override
    public boolean cancelSync(String scopeKey) {
        CancellationToken token = activeRuns.get(scopeKey);
        if (token == null || !progressTracker.get(scopeKey).isProcessing()) {
            logger.debug("No running sync to cancel for scope {}", scopeKey);
            return false;
        }
        boolean cancelled = token.cancel("cancelled by request");
        if (cancelled) {
            logger.info("Cancellation requested for scope {}", scopeKey);
        }
        return cancelled;
    }

    @Override
    public void abandonSync(String scopeKey, String reason) {
        CancellationToken token = activeRuns.remove(scopeKey);
        if (token != null) {
            token.cancel(reason);
        }
        logger.warn("Abandoning sync for scope {}: {}", scopeKey, reason);
        failJob(scopeKey, reason);
    }

    void runSync(String scopeKey, MarketplaceClient client, boolean forceRefresh, CancellationToken token) {
        Instant startedAt = clock.instant();
        logger.info("Starting catalog sync for scope {}", scopeKey);

        try {
            FetchResult fetch = catalogFetcher.run(client, forceRefresh, token, (page, accumulated) -> {
                // pages read from the local copy are already stored
                if (!page.fromCache()) {
                    catalogStore.saveAll(scopeKey, page.items());
                }
                if (isCurrentRun(scopeKey, token)) {
                    int total = page.total() > 0 ? page.total() : accumulated;
                    progressTracker.update(scopeKey,
                            new SyncProgress(accumulated, total, "Fetched " + accumulated + " items"));
                }
            });
            finishRun(scopeKey, token, fetch, startedAt);
        } catch (Exception e) {
            logger.error("Catalog sync failed for scope {}", scopeKey, e);
            if (isCurrentRun(scopeKey, token)) {
                failJob(scopeKey, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        } finally {
            activeRuns.remove(scopeKey, token);
        }
    }

    private void finishRun(String scopeKey, CancellationToken token, FetchResult fetch, Instant startedAt) {
        if (!isCurrentRun(scopeKey, token)) {
            logger.info("Discarding result of abandoned sync for scope {} ({} items)", scopeKey, fetch.items().size());
            return;
        }

        if (fetch.outcome() == FetchOutcome.CANCELLED) {
            failJob(scopeKey, "Sync cancelled: " + (token.reason() != null ? token.reason() : "interrupted"));
            return;
        }
        if (fetch.outcome() == FetchOutcome.TOO_MANY_ERRORS && fetch.items().isEmpty()) {
            failJob(scopeKey, fetch.lastErrorMessage() != null ? fetch.lastErrorMessage() : fetch.reason());
            return;
        }

        int synced = fetch.items().size();
        long durationSeconds = Duration.between(startedAt, clock.instant()).toSeconds();
        SyncResult result = new SyncResult(
                synced,
                Math.max(fetch.totalReported(), synced),
                durationSeconds,
                fetch.errorCount(),
                fetch.isPartial(),
                fetch.reason());

        try {
            progressTracker.complete(scopeKey, result);
        } catch (SyncJobStateException e) {
            logger.warn("Sync job for scope {} finished elsewhere: {}", scopeKey, e.getMessage());
            return;
        }

        if (!fetch.isPartial() && !fetch.fromCache()) {
            syncMetadata.updateLastSyncTime(scopeKey, clock.instant());
            syncMetadata.updateItemCount(scopeKey, synced);
        }
        syncMetadata.updateSyncStatus(scopeKey, SyncStatus.COMPLETED.name());
        logger.info("Catalog sync for scope {} finished: {} items in {}s ({})",
                scopeKey, synced, durationSeconds, fetch.reason());
    }

    private void failJob(String scopeKey, String error) {
        try {
            progressTracker.fail(scopeKey, error);
        } catch (SyncJobStateException e) {
            logger.warn("Sync job for scope {} already finished: {}", scopeKey, e.getMessage());
            return;
        }
        syncMetadata.updateSyncStatus(scopeKey, SyncStatus.ERROR.name());
    }

    private boolean isCurrentRun(String scopeKey, CancellationToken token) {
        return activeRuns.get(scopeKey) == token;
    }
}
