package com.smoothcomp.calendar.infrastructure.web;

import com.smoothcomp.calendar.application.FindEvents;
import com.smoothcomp.calendar.application.RefreshEventsUseCase;
import com.smoothcomp.calendar.domain.model.EventFilter;
import com.smoothcomp.calendar.infrastructure.calendar.ICalendarRenderer;
import com.smoothcomp.calendar.infrastructure.config.SmoothcompProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
public class CalendarController {

    private static final Logger logger = LoggerFactory.getLogger(CalendarController.class);

    static final MediaType TEXT_CALENDAR = new MediaType("text", "calendar");
    static final String FILENAME = "smoothcomp.ics";

    private final FindEvents findEvents;
    private final RefreshEventsUseCase refreshEvents;
    private final ICalendarRenderer renderer;
    private final SmoothcompProperties.Calendar calendarProperties;

    public CalendarController(FindEvents findEvents,
                              RefreshEventsUseCase refreshEvents,
                              ICalendarRenderer renderer,
                              SmoothcompProperties properties) {
        this.findEvents = findEvents;
        this.refreshEvents = refreshEvents;
        this.renderer = renderer;
        this.calendarProperties = properties.getCalendar();
    }

    @GetMapping("/calendar.ics")
    public ResponseEntity<byte[]> getCalendar(
            @RequestParam(value = "country", required = false) String country,
            @RequestParam(value = "sport", required = false) String sport,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        EventFilter filter = RequestFilters.of(country, sport, limit);
        refreshEvents.maybeRefresh();

        var events = findEvents.findEvents(filter);
        String name = calendarName(filter);
        logger.info("Rendering calendar '{}' with {} events", name, events.size());

        byte[] body = renderer.render(events, name, calendarProperties.getTtlMinutes());
        return ResponseEntity.ok()
                .contentType(TEXT_CALENDAR)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(FILENAME).build().toString())
                .body(body);
    }

    /**
     * "Smoothcomp Brazil BJJ Events" for a feed filtered by country and sport.
     */
    String calendarName(EventFilter filter) {
        List<String> parts = new ArrayList<>();
        parts.add(calendarProperties.getNamePrefix());
        if (filter.hasCountry()) {
            parts.add(filter.country().trim());
        }
        if (filter.hasSport()) {
            parts.add(filter.sport().trim());
        }
        parts.add("Events");
        return String.join(" ", parts);
    }
}
