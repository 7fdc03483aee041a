package com.smoothcomp.calendar.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of fetching one event detail page: either an event or a skip with the reason.
 * Per-page failures are reported through this type instead of exceptions.
 */
public final class EventFetchResult {

    private final Event event;
    private final String skipReason;

    private EventFetchResult(Event event, String skipReason) {
        this.event = event;
        this.skipReason = skipReason;
    }

    public static EventFetchResult found(Event event) {
        return new EventFetchResult(Objects.requireNonNull(event, "event"), null);
    }

    public static EventFetchResult skipped(String reason) {
        return new EventFetchResult(null, reason);
    }

    public boolean isFound() {
        return event != null;
    }

    public Optional<Event> event() {
        return Optional.ofNullable(event);
    }

    public String skipReason() {
        return skipReason;
    }

    @Override
    public String toString() {
        return isFound() ? "found(" + event.id() + ")" : "skipped(" + skipReason + ")";
    }
}
