package com.stockdesk.catalogsync.infrastructure.web.dto;

public record SyncCancelResponse(
        boolean cancelled
) {}
