package com.smoothcomp.calendar.infrastructure.web;

import com.smoothcomp.calendar.application.FindEvents;
import com.smoothcomp.calendar.application.RefreshEventsUseCase;
import com.smoothcomp.calendar.domain.model.EventFilter;
import com.smoothcomp.calendar.infrastructure.web.dto.CountryListResponse;
import com.smoothcomp.calendar.infrastructure.web.dto.EventListResponse;
import com.smoothcomp.calendar.infrastructure.web.dto.FilterOptionsResponse;
import com.smoothcomp.calendar.infrastructure.web.dto.SportListResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final FindEvents findEvents;
    private final RefreshEventsUseCase refreshEvents;

    public EventController(FindEvents findEvents, RefreshEventsUseCase refreshEvents) {
        this.findEvents = findEvents;
        this.refreshEvents = refreshEvents;
    }

    @GetMapping("/events")
    public ResponseEntity<EventListResponse> getEvents(
            @RequestParam(value = "country", required = false) String country,
            @RequestParam(value = "sport", required = false) String sport,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        EventFilter filter = RequestFilters.of(country, sport, limit);
        refreshEvents.maybeRefresh();

        var events = findEvents.findEvents(filter);
        logger.info("Found {} events (country={}, sport={}, limit={})", events.size(), country, sport, limit);
        return ResponseEntity.ok(EventListResponse.fromEvents(events, country, sport));
    }

    @GetMapping("/countries")
    public ResponseEntity<CountryListResponse> getCountries() {
        return ResponseEntity.ok(CountryListResponse.fromFacets(findEvents.countries()));
    }

    @GetMapping("/sports")
    public ResponseEntity<SportListResponse> getSports() {
        return ResponseEntity.ok(SportListResponse.fromFacets(findEvents.sports()));
    }

    @GetMapping("/filter-options")
    public ResponseEntity<FilterOptionsResponse> getFilterOptions(
            @RequestParam(value = "country", required = false) String country,
            @RequestParam(value = "sport", required = false) String sport
    ) {
        return ResponseEntity.ok(FilterOptionsResponse.fromOptions(findEvents.filterOptions(country, sport)));
    }
}
