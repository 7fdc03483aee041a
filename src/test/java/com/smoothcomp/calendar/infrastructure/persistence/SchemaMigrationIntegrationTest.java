package com.smoothcomp.calendar.infrastructure.persistence;

import com.smoothcomp.calendar.domain.model.Event;
import com.smoothcomp.calendar.domain.model.EventFilter;
import com.smoothcomp.calendar.support.MutableClock;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Adopting a store that was created before migrations existed.
 */
@Testcontainers(disabledWithoutDocker = true)
class SchemaMigrationIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>("postgres:15-alpine")
                    .withDatabaseName("smoothcomp_legacy")
                    .withUsername("test")
                    .withPassword("test");

    @Test
    void shouldRenameCachedAtAndKeepExistingRows() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(postgres.getJdbcUrl());
        config.setUsername(postgres.getUsername());
        config.setPassword(postgres.getPassword());

        try (HikariDataSource dataSource = new HikariDataSource(config)) {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);

            // Given: the legacy layout, with data
            jdbcTemplate.execute("""
                    CREATE TABLE events (
                        id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        url TEXT NOT NULL,
                        start_date TIMESTAMP,
                        end_date TIMESTAMP,
                        location TEXT,
                        city TEXT,
                        country TEXT,
                        sport TEXT,
                        organizer TEXT,
                        participants INTEGER,
                        registration_open BOOLEAN DEFAULT FALSE,
                        cached_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                    )
                    """);
            jdbcTemplate.update("""
                    INSERT INTO events (id, name, url, start_date, country, cached_at)
                    VALUES ('77', 'Legacy Open', 'https://smoothcomp.com/en/event/77',
                            '2030-01-01 10:00:00', 'Japan', '2025-01-01 00:00:00')
                    """);

            // When
            Flyway.configure()
                    .dataSource(dataSource)
                    .baselineOnMigrate(true)
                    .baselineVersion("0")
                    .load()
                    .migrate();

            // Then
            List<String> columns = jdbcTemplate.queryForList("""
                    SELECT column_name FROM information_schema.columns
                    WHERE table_schema = current_schema() AND table_name = 'events'
                    """, String.class);
            assertThat(columns).contains("updated_at").doesNotContain("cached_at");

            assertThat(jdbcTemplate.queryForObject("SELECT name FROM events WHERE id = '77'", String.class))
                    .isEqualTo("Legacy Open");
            assertThat(jdbcTemplate.queryForList("""
                    SELECT data_type FROM information_schema.columns
                    WHERE table_schema = current_schema() AND table_name = 'events'
                      AND column_name IN ('start_date', 'end_date', 'updated_at')
                    """, String.class))
                    .hasSize(3)
                    .containsOnly("timestamp with time zone");

            // zone-less legacy values were UTC
            assertThat(jdbcTemplate.queryForObject(
                    "SELECT start_date FROM events WHERE id = '77'", OffsetDateTime.class).toInstant())
                    .isEqualTo(Instant.parse("2030-01-01T10:00:00Z"));
            assertThat(jdbcTemplate.queryForObject(
                    "SELECT updated_at FROM events WHERE id = '77'", OffsetDateTime.class).toInstant())
                    .isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));

            JdbcEventRepository repository = new JdbcEventRepository(
                    jdbcTemplate, new MutableClock(Instant.parse("2025-05-01T12:00:00Z")));
            assertThat(repository.findEvents(EventFilter.none()))
                    .extracting(Event::startDate)
                    .containsExactly(Instant.parse("2030-01-01T10:00:00Z"));
            assertThat(jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM cache_meta", Integer.class)).isZero();
        }
    }
}
