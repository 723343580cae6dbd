package com.stockdesk.catalogsync.domain.model;

import java.util.List;

public record CatalogSnapshot(
        List<CatalogItem> items,
        boolean fromCache
) {
    public CatalogSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public int count() {
        return items.size();
    }
}
