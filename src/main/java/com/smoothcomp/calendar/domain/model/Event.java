package com.smoothcomp.calendar.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One scraped Smoothcomp event, keyed by the source-assigned id.
 * Everything except id, name and url may be absent.
 */
public record Event(
        String id,
        String name,
        String url,
        Instant startDate,
        Instant endDate,
        String location,
        String city,
        String country,
        String sport,
        String organizer,
        Integer participants,
        boolean registrationOpen
) {

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
    }

    /**
     * Minimal record used when a page carries no structured data.
     */
    public static Event titleOnly(String id, String name, String url) {
        return new Event(id, name, url, null, null, null, null, null, null, null, null, false);
    }

    public boolean hasStartDate() {
        return startDate != null;
    }

    public boolean startsBefore(Instant instant) {
        return startDate != null && startDate.isBefore(instant);
    }
}
