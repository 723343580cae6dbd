package com.stockdesk.catalogsync.domain.port.out;

import java.time.Instant;

public interface SyncMetadataService {

    void updateSyncStatus(String scopeKey, String status);

    void updateLastSyncTime(String scopeKey, Instant syncTime);

    void updateItemCount(String scopeKey, int count);

    Instant getLastSyncTime(String scopeKey);

    int getItemCount(String scopeKey);
}
