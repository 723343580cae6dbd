package com.stockdesk.catalogsync.domain.model;

import java.math.BigDecimal;

public record CatalogItem(
        String externalId,
        String offerId,
        String name,
        BigDecimal price,
        int stock
) {}
