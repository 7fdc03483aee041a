package com.smoothcomp.calendar.infrastructure.web.dto;

import com.smoothcomp.calendar.domain.model.Event;

import java.time.Instant;

public record EventDto(
        String id,
        String name,
        String url,
        Instant start_date,
        Instant end_date,
        String location,
        String city,
        String country,
        String sport,
        String organizer,
        Integer participants,
        boolean registration_open
) {
    public static EventDto fromEvent(Event event) {
        return new EventDto(
                event.id(),
                event.name(),
                event.url(),
                event.startDate(),
                event.endDate(),
                event.location(),
                event.city(),
                event.country(),
                event.sport(),
                event.organizer(),
                event.participants(),
                event.registrationOpen()
        );
    }
}
