package com.stockdesk.catalogsync.application;

import com.stockdesk.catalogsync.domain.model.CatalogSnapshot;

public interface ReadCachedCatalog {

    /**
     * Single bulk read of a scope's catalog, served from the local copy when it is fresh.
     *
     * @param limit maximum number of items; non-positive means the configured default
     */
    CatalogSnapshot readCached(String scopeKey, int limit);
}
