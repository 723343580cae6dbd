package com.stockdesk.catalogsync.infrastructure.cron;

import com.stockdesk.catalogsync.application.SyncCatalog;
import com.stockdesk.catalogsync.application.progress.SyncJobProperties;
import com.stockdesk.catalogsync.application.progress.SyncProgressTracker;
import com.stockdesk.catalogsync.domain.model.SyncJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fails sync jobs that stopped reporting progress and forgets finished jobs after their retention.
 */
@Service
@ConditionalOnProperty(prefix = "catalog.sync", name = "guard-enabled", havingValue = "true", matchIfMissing = true)
public class StuckSyncJobGuard {

    private static final Logger logger = LoggerFactory.getLogger(StuckSyncJobGuard.class);

    private final SyncCatalog syncCatalog;
    private final SyncProgressTracker progressTracker;
    private final SyncJobProperties properties;

    public StuckSyncJobGuard(SyncCatalog syncCatalog, SyncProgressTracker progressTracker, SyncJobProperties properties) {
        this.syncCatalog = syncCatalog;
        this.progressTracker = progressTracker;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${catalog.sync.guard-interval:PT60S}")
    public void sweep() {
        List<SyncJob> stalled = progressTracker.findStalled(properties.getStuckTimeout());
        for (SyncJob job : stalled) {
            logger.warn("Sync for scope {} made no progress since {}, abandoning", job.scopeKey(), job.updatedAt());
            syncCatalog.abandonSync(job.scopeKey(),
                    "Sync timed out after " + properties.getStuckTimeout().toMinutes() + " minutes without progress");
        }

        int evicted = progressTracker.evictFinished(properties.getFinishedRetention());
        if (!stalled.isEmpty() || evicted > 0) {
            logger.info("Sync guard: {} stalled job(s) abandoned, {} finished job(s) evicted", stalled.size(), evicted);
        }
    }
}
