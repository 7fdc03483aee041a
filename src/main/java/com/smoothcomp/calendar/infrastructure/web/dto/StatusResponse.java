package com.smoothcomp.calendar.infrastructure.web.dto;

import com.smoothcomp.calendar.domain.model.CacheStatus;

import java.time.Instant;

public record StatusResponse(
        boolean healthy,
        long event_count,
        Instant last_update,
        Long cache_age_minutes,
        long auto_refresh_threshold_minutes,
        boolean scraping_in_progress
) {
    public static StatusResponse fromStatus(CacheStatus status) {
        return new StatusResponse(
                true,
                status.eventCount(),
                status.lastUpdate(),
                status.cacheAgeMinutes(),
                status.refreshThresholdMinutes(),
                status.scrapingInProgress()
        );
    }
}
