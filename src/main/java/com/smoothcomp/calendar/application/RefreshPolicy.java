package com.smoothcomp.calendar.application;

import java.time.Duration;

/**
 * @param ttl       age after which the last successful refresh counts as stale
 * @param maxEvents optional cap on listing URLs per cycle, null for all
 */
public record RefreshPolicy(Duration ttl, Integer maxEvents) {

    public static RefreshPolicy ofTtl(Duration ttl) {
        return new RefreshPolicy(ttl, null);
    }
}
