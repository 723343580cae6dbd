package com.stockdesk.catalogsync.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.stockdesk.catalogsync.domain.model.SyncJob;
import com.stockdesk.catalogsync.domain.model.SyncResult;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncProgressResponse(
        String status,
        ProgressDto progress,
        ResultDto result,
        String error
) {
    public static SyncProgressResponse fromJob(SyncJob job) {
        return new SyncProgressResponse(
                job.status().name().toLowerCase(Locale.ROOT),
                new ProgressDto(job.progress().current(), job.progress().total(), job.progress().stage()),
                job.result() != null ? ResultDto.fromResult(job.result()) : null,
                job.error()
        );
    }

    public record ProgressDto(
            int current,
            int total,
            String stage
    ) {}

    public record ResultDto(
            int total,
            int synced,
            int errors,
            long duration,
            boolean partial,
            String stopReason
    ) {
        public static ResultDto fromResult(SyncResult result) {
            return new ResultDto(
                    result.totalCount(),
                    result.syncedCount(),
                    result.errorCount(),
                    result.durationSeconds(),
                    result.partial(),
                    result.stopReason()
            );
        }
    }
}
