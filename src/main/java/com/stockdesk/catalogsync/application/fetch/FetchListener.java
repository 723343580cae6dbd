package com.stockdesk.catalogsync.application.fetch;

import com.stockdesk.catalogsync.domain.model.CatalogPage;

/**
 * Receives every page the fetch loop accepts, in order. Exceptions thrown here abort the loop.
 */
@FunctionalInterface
public interface FetchListener {

    FetchListener NONE = (page, accumulated) -> { };

    /**
     * @param page the page just fetched
     * @param accumulated items collected so far, this page included
     */
    void onPage(CatalogPage page, int accumulated);
}
