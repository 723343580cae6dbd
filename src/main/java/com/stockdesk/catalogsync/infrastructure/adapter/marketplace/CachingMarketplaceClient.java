package com.stockdesk.catalogsync.infrastructure.adapter.marketplace;

import com.stockdesk.catalogsync.domain.model.CatalogItem;
import com.stockdesk.catalogsync.domain.model.CatalogPage;
import com.stockdesk.catalogsync.domain.model.CatalogSnapshot;
import com.stockdesk.catalogsync.domain.port.out.CatalogStore;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClient;
import com.stockdesk.catalogsync.domain.port.out.SyncMetadataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Serves catalog reads from the local copy while the last full sync is recent enough,
 * using decorator pattern over the remote client.
 *
 * <p>A run that starts locally pages through the local copy with {@code local:<offset>} cursors and stays local
 * until its last page, a failed local read of such a page fails that page. When the first local read fails the
 * run starts over at the marketplace.
 */
public class CachingMarketplaceClient implements MarketplaceClient {

    static final String LOCAL_CURSOR_PREFIX = "local:";

    private static final Logger logger = LoggerFactory.getLogger(CachingMarketplaceClient.class);

    private final String scopeKey;
    private final MarketplaceClient remoteClient;
    private final CatalogStore catalogStore;
    private final SyncMetadataService syncMetadata;
    private final Duration freshness;
    private final Clock clock;

    public CachingMarketplaceClient(String scopeKey,
                                    MarketplaceClient remoteClient,
                                    CatalogStore catalogStore,
                                    SyncMetadataService syncMetadata,
                                    Duration freshness,
                                    Clock clock) {
        this.scopeKey = scopeKey;
        this.remoteClient = remoteClient;
        this.catalogStore = catalogStore;
        this.syncMetadata = syncMetadata;
        this.freshness = freshness;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<CatalogPage> fetchPage(int limit, String cursor, boolean forceRefresh) {
        if (cursor != null && cursor.startsWith(LOCAL_CURSOR_PREFIX)) {
            Integer offset = parseOffset(cursor.substring(LOCAL_CURSOR_PREFIX.length()));
            if (offset == null) {
                return CompletableFuture.failedFuture(
                        new IllegalArgumentException("Malformed local cursor: " + cursor));
            }
            try {
                return CompletableFuture.completedFuture(readLocalPage(offset, limit));
            } catch (Exception e) {
                logger.warn("Local catalog read failed for scope {} at offset {}: {}", scopeKey, offset, e.getMessage());
                return CompletableFuture.failedFuture(e);
            }
        }

        if (cursor == null && !forceRefresh && isCacheFresh()) {
            try {
                return CompletableFuture.completedFuture(readLocalPage(0, limit));
            } catch (Exception e) {
                logger.warn("Local catalog read failed for scope {}, starting over at marketplace: {}",
                        scopeKey, e.getMessage());
            }
        }
        return remoteClient.fetchPage(limit, cursor, forceRefresh);
    }

    @Override
    public CompletableFuture<CatalogSnapshot> fetchAll(int limit) {
        try {
            List<CatalogItem> items = catalogStore.findAll(scopeKey, limit);
            if (!items.isEmpty() || syncMetadata.getLastSyncTime(scopeKey) != null) {
                logger.debug("Read {} cached items for scope {}", items.size(), scopeKey);
                return CompletableFuture.completedFuture(new CatalogSnapshot(items, true));
            }
            logger.debug("No local catalog for scope {} yet, asking marketplace", scopeKey);
        } catch (Exception e) {
            logger.error("Error reading local catalog for scope {}, falling back to marketplace", scopeKey, e);
        }
        return remoteClient.fetchAll(limit);
    }

    private boolean isCacheFresh() {
        Instant lastSync = syncMetadata.getLastSyncTime(scopeKey);
        return lastSync != null && lastSync.isAfter(clock.instant().minus(freshness));
    }

    private CatalogPage readLocalPage(int offset, int limit) {
        List<CatalogItem> items = catalogStore.findPage(scopeKey, offset, limit);
        String nextCursor = items.size() < limit ? null : LOCAL_CURSOR_PREFIX + (offset + items.size());
        logger.debug("Cache hit for scope {}: {} items at offset {}", scopeKey, items.size(), offset);
        return new CatalogPage(items, nextCursor, syncMetadata.getItemCount(scopeKey), true);
    }

    private static Integer parseOffset(String value) {
        try {
            int offset = Integer.parseInt(value);
            return offset >= 0 ? offset : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
