package com.smoothcomp.calendar.infrastructure.calendar;

import biweekly.Biweekly;
import biweekly.ICalendar;
import biweekly.component.VEvent;
import biweekly.property.CalendarScale;
import biweekly.property.Method;
import com.smoothcomp.calendar.domain.model.Event;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Formats events as an iCalendar feed. Output only depends on the events and the render time.
 */
@Component
public class ICalendarRenderer {

    static final String PRODUCT_ID = "-//Smoothcomp Calendar//smoothcomp.com//";
    static final String UID_DOMAIN = "@smoothcomp.com";
    static final Duration DEFAULT_EVENT_LENGTH = Duration.ofHours(8);

    private final Clock clock;

    public ICalendarRenderer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Events without a start date are left out.
     *
     * @param ttlMinutes refresh interval suggested to subscribing clients
     * @return the UTF-8 encoded calendar
     */
    public byte[] render(List<Event> events, String calendarName, int ttlMinutes) {
        ICalendar ical = new ICalendar();
        ical.setProductId(PRODUCT_ID);
        ical.setCalendarScale(CalendarScale.gregorian());
        ical.setMethod(Method.publish());
        ical.setExperimentalProperty("X-WR-CALNAME", calendarName);
        ical.setExperimentalProperty("X-WR-TIMEZONE", "UTC");
        ical.setRefreshInterval(biweekly.util.Duration.builder().minutes(ttlMinutes).build());
        ical.setExperimentalProperty("X-PUBLISHED-TTL", "PT" + ttlMinutes + "M");

        Date stamp = Date.from(clock.instant());
        for (Event event : events) {
            if (event.hasStartDate()) {
                ical.addEvent(toVEvent(event, stamp));
            }
        }

        return Biweekly.write(ical).go().getBytes(StandardCharsets.UTF_8);
    }

    private static VEvent toVEvent(Event event, Date stamp) {
        Instant start = event.startDate();
        Instant end = event.endDate() != null ? event.endDate() : start.plus(DEFAULT_EVENT_LENGTH);

        VEvent vEvent = new VEvent();
        vEvent.setUid(event.id() + UID_DOMAIN);
        vEvent.setDateTimeStamp(stamp);
        vEvent.setDateStart(Date.from(start));
        vEvent.setDateEnd(Date.from(end));
        vEvent.setSummary(event.name());

        String location = location(event);
        if (!location.isEmpty()) {
            vEvent.setLocation(location);
        }

        vEvent.setDescription(description(event));
        vEvent.setUrl(event.url());

        if (event.sport() != null) {
            vEvent.addCategories(event.sport());
        }
        return vEvent;
    }

    private static String location(Event event) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, event.location());
        addIfPresent(parts, event.city());
        addIfPresent(parts, event.country());
        return String.join(", ", parts);
    }

    private static String description(Event event) {
        List<String> lines = new ArrayList<>();
        if (event.sport() != null) {
            lines.add("Sport: " + event.sport());
        }
        if (event.organizer() != null) {
            lines.add("Organizer: " + event.organizer());
        }
        if (event.participants() != null && event.participants() > 0) {
            lines.add("Participants: " + event.participants());
        }
        lines.add("Details: " + event.url());
        return String.join("\n", lines);
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value);
        }
    }
}
