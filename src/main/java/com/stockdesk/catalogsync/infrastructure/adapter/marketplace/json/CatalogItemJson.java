package com.stockdesk.catalogsync.infrastructure.adapter.marketplace.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogItemJson(
        @JsonProperty("product_id")
        String productId,

        @JsonProperty("offer_id")
        String offerId,

        @JsonProperty("name")
        String name,

        @JsonProperty("price")
        BigDecimal price,

        @JsonProperty("stock")
        Integer stock
) {}
