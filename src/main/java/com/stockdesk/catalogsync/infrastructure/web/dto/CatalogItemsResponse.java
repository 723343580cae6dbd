package com.stockdesk.catalogsync.infrastructure.web.dto;

import com.stockdesk.catalogsync.domain.model.CatalogItem;
import com.stockdesk.catalogsync.domain.model.CatalogSnapshot;
import java.math.BigDecimal;
import java.util.List;

public record CatalogItemsResponse(
        List<CatalogItemDto> items,
        int count,
        boolean fromCache
) {
    public static CatalogItemsResponse fromSnapshot(CatalogSnapshot snapshot) {
        var itemDtos = snapshot.items().stream()
                .map(CatalogItemDto::fromItem)
                .toList();

        return new CatalogItemsResponse(itemDtos, itemDtos.size(), snapshot.fromCache());
    }

    public static CatalogItemsResponse empty() {
        return new CatalogItemsResponse(List.of(), 0, false);
    }

    public record CatalogItemDto(
            String externalId,
            String offerId,
            String name,
            BigDecimal price,
            int stock
    ) {
        public static CatalogItemDto fromItem(CatalogItem item) {
            return new CatalogItemDto(
                    item.externalId(),
                    item.offerId(),
                    item.name(),
                    item.price(),
                    item.stock()
            );
        }
    }
}
