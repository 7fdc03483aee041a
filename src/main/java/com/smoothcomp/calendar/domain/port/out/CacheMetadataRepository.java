package com.smoothcomp.calendar.domain.port.out;

import java.time.Instant;
import java.util.Optional;

/**
 * Bookkeeping for refresh cycles, kept next to the events it describes.
 */
public interface CacheMetadataRepository {

    /**
     * Record the current time as the completion of a successful refresh cycle.
     */
    Instant markRefreshComplete();

    /**
     * Completion time of the last successful cycle, empty if the cache was never refreshed.
     */
    Optional<Instant> findLastUpdate();
}
