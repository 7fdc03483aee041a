package com.smoothcomp.calendar.domain.model;

import java.time.Instant;

public record CacheStatus(
        long eventCount,
        Instant lastUpdate,
        Long cacheAgeMinutes,
        long refreshThresholdMinutes,
        boolean scrapingInProgress
) {}
