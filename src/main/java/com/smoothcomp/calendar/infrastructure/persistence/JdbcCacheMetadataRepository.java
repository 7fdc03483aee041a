package com.smoothcomp.calendar.infrastructure.persistence;

import com.smoothcomp.calendar.domain.port.out.CacheMetadataRepository;
import com.smoothcomp.calendar.domain.port.out.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Refresh bookkeeping in the {@code cache_meta} key/value table.
 */
@Repository
public class JdbcCacheMetadataRepository implements CacheMetadataRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcCacheMetadataRepository.class);

    static final String LAST_UPDATE_KEY = "last_update";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcCacheMetadataRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Instant markRefreshComplete() {
        Instant now = clock.instant();
        String sql = """
            INSERT INTO cache_meta (key, value) VALUES (?, ?)
            ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value
            """;

        try {
            jdbcTemplate.update(sql, LAST_UPDATE_KEY, now.toString());
            logger.debug("Recorded refresh completion at {}", now);
            return now;
        } catch (DataAccessException e) {
            logger.error("Error recording refresh completion", e);
            throw new EventStoreException("Failed to record refresh completion", e);
        }
    }

    @Override
    public Optional<Instant> findLastUpdate() {
        List<String> values;
        try {
            values = jdbcTemplate.queryForList(
                    "SELECT value FROM cache_meta WHERE key = ?", String.class, LAST_UPDATE_KEY);
        } catch (DataAccessException e) {
            logger.error("Error reading last refresh time", e);
            throw new EventStoreException("Failed to read last refresh time", e);
        }

        if (values.isEmpty() || values.get(0) == null) {
            return Optional.empty();
        }
        return parse(values.get(0));
    }

    /**
     * Stores written before this service existed hold local timestamps without an offset;
     * those are read as UTC.
     */
    private static Optional<Instant> parse(String value) {
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(value.replace(' ', 'T')).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException unreadable) {
                logger.warn("Ignoring unreadable last_update value '{}'", value);
                return Optional.empty();
            }
        }
    }
}
