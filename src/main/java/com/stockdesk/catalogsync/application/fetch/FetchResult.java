package com.stockdesk.catalogsync.application.fetch;

import com.stockdesk.catalogsync.domain.model.CatalogItem;
import java.util.List;

public record FetchResult(
        List<CatalogItem> items,
        FetchOutcome outcome,
        int pagesFetched,
        int totalReported,
        int errorCount,
        String lastErrorMessage,
        boolean fromCache
) {
    public FetchResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean isPartial() {
        return outcome.isPartial();
    }

    public String reason() {
        if (outcome == FetchOutcome.TOO_MANY_ERRORS && lastErrorMessage != null) {
            return outcome.getDescription() + ": " + lastErrorMessage;
        }
        return outcome.getDescription();
    }
}
