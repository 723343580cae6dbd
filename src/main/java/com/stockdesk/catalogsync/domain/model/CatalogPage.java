package com.stockdesk.catalogsync.domain.model;

import java.util.List;

/**
 * One page of a remote catalog.
 * A null or blank {@code nextCursor} marks the end of the catalog; {@code total} is 0 when the source does not report it.
 */
public record CatalogPage(
        List<CatalogItem> items,
        String nextCursor,
        int total,
        boolean fromCache
) {
    public CatalogPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasNextCursor() {
        return nextCursor != null && !nextCursor.isBlank();
    }

    public static CatalogPage last(List<CatalogItem> items, boolean fromCache) {
        return new CatalogPage(items, null, 0, fromCache);
    }
}
