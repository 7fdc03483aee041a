package com.smoothcomp.calendar.infrastructure.web.dto;

import com.smoothcomp.calendar.domain.model.Event;

import java.util.List;

public record EventListResponse(
        int count,
        Filters filters,
        List<EventDto> events
) {
    public static EventListResponse fromEvents(List<Event> events, String country, String sport) {
        var eventDtos = events.stream()
                .map(EventDto::fromEvent)
                .toList();

        return new EventListResponse(eventDtos.size(), new Filters(country, sport), eventDtos);
    }

    public record Filters(
            String country,
            String sport
    ) {}
}
