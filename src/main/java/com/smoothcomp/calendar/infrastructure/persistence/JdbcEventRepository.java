package com.smoothcomp.calendar.infrastructure.persistence;

import com.smoothcomp.calendar.domain.model.Event;
import com.smoothcomp.calendar.domain.model.EventFilter;
import com.smoothcomp.calendar.domain.model.FacetCount;
import com.smoothcomp.calendar.domain.model.RetirementResult;
import com.smoothcomp.calendar.domain.port.out.EventFacet;
import com.smoothcomp.calendar.domain.port.out.EventRepository;
import com.smoothcomp.calendar.domain.port.out.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * PostgreSQL implementation of EventRepository.
 * Every write is committed on return; there is no caching in front of the table.
 */
@Repository
public class JdbcEventRepository implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEventRepository.class);

    private static final String SELECT_COLUMNS = """
            SELECT id, name, url, start_date, end_date, location, city, country,
                   sport, organizer, participants, registration_open
            FROM events
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO events (
                id, name, url, start_date, end_date, location, city, country,
                sport, organizer, participants, registration_open, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                url = EXCLUDED.url,
                start_date = EXCLUDED.start_date,
                end_date = EXCLUDED.end_date,
                location = EXCLUDED.location,
                city = EXCLUDED.city,
                country = EXCLUDED.country,
                sport = EXCLUDED.sport,
                organizer = EXCLUDED.organizer,
                participants = EXCLUDED.participants,
                registration_open = EXCLUDED.registration_open,
                updated_at = EXCLUDED.updated_at
            """;

    private static final int[] UPSERT_TYPES = {
            Types.VARCHAR, Types.VARCHAR, Types.VARCHAR,
            Types.TIMESTAMP_WITH_TIMEZONE, Types.TIMESTAMP_WITH_TIMEZONE,
            Types.VARCHAR, Types.VARCHAR, Types.VARCHAR, Types.VARCHAR, Types.VARCHAR,
            Types.INTEGER, Types.BOOLEAN, Types.TIMESTAMP_WITH_TIMEZONE
    };

    private static final RowMapper<Event> EVENT_ROW_MAPPER = (rs, rowNum) -> new Event(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("url"),
            toInstant(rs.getObject("start_date", OffsetDateTime.class)),
            toInstant(rs.getObject("end_date", OffsetDateTime.class)),
            rs.getString("location"),
            rs.getString("city"),
            rs.getString("country"),
            rs.getString("sport"),
            rs.getString("organizer"),
            rs.getObject("participants", Integer.class),
            rs.getBoolean("registration_open")
    );

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Set<String> findExistingIds() {
        try {
            return new HashSet<>(jdbcTemplate.queryForList("SELECT id FROM events", String.class));
        } catch (DataAccessException e) {
            logger.error("Error loading existing event ids", e);
            throw new EventStoreException("Failed to load existing event ids", e);
        }
    }

    @Override
    public boolean upsert(Event event, Instant refreshTime) {
        if (event.startsBefore(clock.instant())) {
            logger.debug("Not storing past event {} ({})", event.id(), event.startDate());
            return false;
        }

        Object[] args = {
                event.id(),
                event.name(),
                event.url(),
                toOffsetDateTime(event.startDate()),
                toOffsetDateTime(event.endDate()),
                event.location(),
                event.city(),
                event.country(),
                event.sport(),
                event.organizer(),
                event.participants(),
                event.registrationOpen(),
                toOffsetDateTime(refreshTime)
        };

        try {
            jdbcTemplate.update(UPSERT_SQL, args, UPSERT_TYPES);
            return true;
        } catch (DataAccessException e) {
            logger.error("Error saving event {}", event.id(), e);
            throw new EventStoreException("Failed to save event " + event.id(), e);
        }
    }

    @Override
    @Transactional
    public RetirementResult retireStale(Instant refreshTime) {
        try {
            int byAge = jdbcTemplate.update(
                    "DELETE FROM events WHERE updated_at < ? OR updated_at IS NULL",
                    toOffsetDateTime(refreshTime));
            int byDate = jdbcTemplate.update(
                    "DELETE FROM events WHERE start_date < ?",
                    toOffsetDateTime(clock.instant()));

            logger.info("Retired {} events not seen since {} and {} already started", byAge, refreshTime, byDate);
            return new RetirementResult(byAge, byDate);
        } catch (DataAccessException e) {
            logger.error("Error retiring stale events", e);
            throw new EventStoreException("Failed to retire stale events", e);
        }
    }

    @Override
    public List<Event> findEvents(EventFilter filter) {
        Conditions conditions = Conditions.of(filter);
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
                .append(conditions.where())
                .append(" ORDER BY start_date ASC NULLS LAST, id");

        List<Object> args = new ArrayList<>(conditions.args());
        if (filter.hasLimit()) {
            sql.append(" LIMIT ?");
            args.add(filter.limit());
        }

        try {
            return jdbcTemplate.query(sql.toString(), EVENT_ROW_MAPPER, args.toArray());
        } catch (DataAccessException e) {
            logger.error("Database error while finding events for {}", filter, e);
            throw new EventStoreException("Failed to query events", e);
        }
    }

    @Override
    public List<FacetCount> countDistinct(EventFacet facet, EventFilter filter) {
        String column = facet.column();
        Conditions conditions = Conditions.of(filter)
                .and(column + " IS NOT NULL")
                .and(column + " <> ''");

        String sql = "SELECT " + column + " AS value, COUNT(*) AS total FROM events"
                + conditions.where()
                + " GROUP BY " + column
                + " ORDER BY total DESC, value ASC";

        try {
            return jdbcTemplate.query(sql,
                    (rs, rowNum) -> new FacetCount(rs.getString("value"), rs.getLong("total")),
                    conditions.args().toArray());
        } catch (DataAccessException e) {
            logger.error("Database error while counting {} values", column, e);
            throw new EventStoreException("Failed to count " + column + " values", e);
        }
    }

    @Override
    public long countEvents(EventFilter filter) {
        Conditions conditions = Conditions.of(filter);
        try {
            Long count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM events" + conditions.where(),
                    Long.class,
                    conditions.args().toArray());
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            logger.error("Database error while counting events", e);
            throw new EventStoreException("Failed to count events", e);
        }
    }

    private static OffsetDateTime toOffsetDateTime(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime dateTime) {
        return dateTime == null ? null : dateTime.toInstant();
    }

    /**
     * WHERE clause built from a filter. Country and sport are case-insensitive substring
     * matches with LIKE wildcards in the input escaped.
     */
    private record Conditions(List<String> clauses, List<Object> args) {

        static Conditions of(EventFilter filter) {
            Conditions conditions = new Conditions(new ArrayList<>(), new ArrayList<>());
            if (filter.hasCountry()) {
                conditions.like("country", filter.country());
            }
            if (filter.hasSport()) {
                conditions.like("sport", filter.sport());
            }
            return conditions;
        }

        Conditions and(String clause) {
            clauses.add(clause);
            return this;
        }

        private void like(String column, String value) {
            clauses.add("LOWER(" + column + ") LIKE ? ESCAPE '\\'");
            args.add("%" + escapeLike(value.trim().toLowerCase(Locale.ROOT)) + "%");
        }

        String where() {
            return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        }

        private static String escapeLike(String value) {
            return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        }
    }
}
