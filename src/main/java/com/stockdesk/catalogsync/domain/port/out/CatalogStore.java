package com.stockdesk.catalogsync.domain.port.out;

import com.stockdesk.catalogsync.domain.model.CatalogItem;
import java.util.List;

/**
 * Local copy of synchronized catalogs, partitioned by scope.
 */
public interface CatalogStore {

    /**
     * Insert or update items by external id.
     */
    void saveAll(String scopeKey, List<CatalogItem> items);

    List<CatalogItem> findPage(String scopeKey, int offset, int limit);

    List<CatalogItem> findAll(String scopeKey, int limit);
}
