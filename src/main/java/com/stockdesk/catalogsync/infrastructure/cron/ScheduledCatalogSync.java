package com.stockdesk.catalogsync.infrastructure.cron;

import com.stockdesk.catalogsync.application.SyncCatalog;
import com.stockdesk.catalogsync.domain.exception.SyncAlreadyRunningException;
import com.stockdesk.catalogsync.infrastructure.adapter.marketplace.MarketplaceApiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Nightly full sync of every configured marketplace account.
 */
@Service
@ConditionalOnProperty(prefix = "catalog.sync", name = "scheduled-enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledCatalogSync {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledCatalogSync.class);

    private final SyncCatalog syncCatalog;
    private final MarketplaceApiProperties marketplaceProperties;

    public ScheduledCatalogSync(SyncCatalog syncCatalog, MarketplaceApiProperties marketplaceProperties) {
        this.syncCatalog = syncCatalog;
        this.marketplaceProperties = marketplaceProperties;
    }

    @Scheduled(cron = "${catalog.sync.cron:0 0 3 * * *}")
    public void syncAll() {
        List<String> scopes = new ArrayList<>(marketplaceProperties.getAccounts().keySet());
        logger.info("Running scheduled full sync for {} scope(s)", scopes.size());

        int started = 0;
        for (String scope : scopes) {
            try {
                syncCatalog.startSync(scope, true);
                started++;
            } catch (SyncAlreadyRunningException e) {
                logger.info("Skipping scheduled sync for scope {}: a sync is already running", scope);
            } catch (Exception e) {
                logger.error("Failed to start scheduled sync for scope {}", scope, e);
            }
        }
        logger.info("Scheduled full sync started for {}/{} scope(s)", started, scopes.size());
    }
}
