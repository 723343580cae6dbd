package com.stockdesk.catalogsync.infrastructure.web.dto;

public record SyncCommandResponse(
        String status,
        String message
) {}
