package com.stockdesk.catalogsync.infrastructure.adapter.mapper;

import com.stockdesk.catalogsync.domain.model.CatalogItem;
import com.stockdesk.catalogsync.domain.model.CatalogPage;
import com.stockdesk.catalogsync.infrastructure.adapter.marketplace.json.CatalogItemJson;
import com.stockdesk.catalogsync.infrastructure.adapter.marketplace.json.CatalogPageJson;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class CatalogItemMapper {

    /**
     * Maps a marketplace page to the domain page.
     * Every item of the response is kept so the page size seen by the fetch loop matches what the marketplace sent.
     */
    public CatalogPage mapToPage(CatalogPageJson json) {
        List<CatalogItem> items = json.items() == null ? List.of() : mapToCatalogItems(json.items());
        int total = json.total() != null ? json.total() : 0;
        return new CatalogPage(items, json.nextCursor(), total, false);
    }

    public List<CatalogItem> mapToCatalogItems(List<CatalogItemJson> items) {
        return items.stream()
                .filter(Objects::nonNull)
                .map(this::mapToItem)
                .toList();
    }

    private CatalogItem mapToItem(CatalogItemJson json) {
        return new CatalogItem(
                blankToNull(json.productId()),
                blankToNull(json.offerId()),
                json.name() != null ? json.name() : "",
                json.price(),
                json.stock() != null ? Math.max(json.stock(), 0) : 0 // missing stock reads as none
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
