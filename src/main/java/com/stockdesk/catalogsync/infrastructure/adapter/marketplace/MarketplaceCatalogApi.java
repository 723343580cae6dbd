package com.stockdesk.catalogsync.infrastructure.adapter.marketplace;

import com.stockdesk.catalogsync.infrastructure.adapter.marketplace.json.CatalogPageJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Query;

/**
 * Cursor-paged catalog endpoint of a marketplace account.
 */
public interface MarketplaceCatalogApi {

    /**
     * Fetches one page of catalog items.
     * Authentication headers are added by the client's interceptor.
     *
     * @param limit maximum number of items to return
     * @param cursor cursor from the previous page; omitted from the query when null
     */
    @GET("catalog/items")
    Call<CatalogPageJson> fetchItems(@Query("limit") int limit, @Query("cursor") String cursor);
}
