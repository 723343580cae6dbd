package com.stockdesk.catalogsync.infrastructure.adapter.marketplace.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogPageJson(
        @JsonProperty("items")
        List<CatalogItemJson> items,

        @JsonProperty("next_cursor")
        String nextCursor,

        @JsonProperty("total")
        Integer total
) {}
