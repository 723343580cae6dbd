package com.stockdesk.catalogsync.application;

import com.stockdesk.catalogsync.application.fetch.CatalogFetchProperties;
import com.stockdesk.catalogsync.domain.model.CatalogSnapshot;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClient;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClientProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;

/**
 * Bulk read of a scope's catalog in one request, without paging or retries.
 */
@Service
public class CachedCatalogUseCase implements ReadCachedCatalog {

    private static final Logger logger = LoggerFactory.getLogger(CachedCatalogUseCase.class);

    private final MarketplaceClientProvider clientProvider;
    private final CatalogFetchProperties fetchProperties;

    public CachedCatalogUseCase(MarketplaceClientProvider clientProvider, CatalogFetchProperties fetchProperties) {
        this.clientProvider = clientProvider;
        this.fetchProperties = fetchProperties;
    }

    @Override
    public CatalogSnapshot readCached(String scopeKey, int limit) {
        int effectiveLimit = effectiveLimit(limit);
        MarketplaceClient client = clientProvider.forScope(scopeKey);
        logger.debug("Reading up to {} catalog items for scope {}", effectiveLimit, scopeKey);

        try {
            CatalogSnapshot snapshot = client.fetchAll(effectiveLimit).get();
            logger.debug("Read {} items for scope {} (fromCache={})", snapshot.count(), scopeKey, snapshot.fromCache());
            return snapshot;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading catalog for scope " + scopeKey, e);
        } catch (ExecutionException e) {
            logger.error("Failed to read catalog for scope {}", scopeKey, e.getCause());
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Failed to read catalog for scope " + scopeKey, e.getCause());
        }
    }

    int effectiveLimit(int requested) {
        if (requested <= 0) {
            return fetchProperties.getBulkReadLimit();
        }
        return Math.min(requested, fetchProperties.getMaxBulkReadLimit());
    }
}
