package com.smoothcomp.calendar.support;

import com.smoothcomp.calendar.domain.port.out.CacheMetadataRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

public class InMemoryCacheMetadataRepository implements CacheMetadataRepository {

    private final Clock clock;
    private volatile Instant lastUpdate;

    public InMemoryCacheMetadataRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Instant markRefreshComplete() {
        lastUpdate = clock.instant();
        return lastUpdate;
    }

    @Override
    public Optional<Instant> findLastUpdate() {
        return Optional.ofNullable(lastUpdate);
    }
}
