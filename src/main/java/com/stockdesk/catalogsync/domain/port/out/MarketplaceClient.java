package com.stockdesk.catalogsync.domain.port.out;

import com.stockdesk.catalogsync.domain.model.CatalogPage;
import com.stockdesk.catalogsync.domain.model.CatalogSnapshot;
import java.util.concurrent.CompletableFuture;

/**
 * Port for reading one marketplace account's catalog.
 * Authentication, request signing and timeouts are the implementation's concern.
 */
public interface MarketplaceClient {

    /**
     * Fetch one page of the catalog.
     *
     * @param limit maximum number of items in the page
     * @param cursor cursor returned with the previous page, or null for the first page
     * @param forceRefresh bypass any local cache and ask the marketplace
     * @return the page; fails with {@link com.stockdesk.catalogsync.domain.exception.RateLimitedException}
     *         when the marketplace throttles the request
     */
    CompletableFuture<CatalogPage> fetchPage(int limit, String cursor, boolean forceRefresh);

    /**
     * Single non-paginated read of up to {@code limit} items.
     */
    CompletableFuture<CatalogSnapshot> fetchAll(int limit);
}
