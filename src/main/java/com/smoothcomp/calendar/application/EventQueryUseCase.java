package com.smoothcomp.calendar.application;

import com.smoothcomp.calendar.domain.model.CacheStatus;
import com.smoothcomp.calendar.domain.model.Event;
import com.smoothcomp.calendar.domain.model.EventFilter;
import com.smoothcomp.calendar.domain.model.FacetCount;
import com.smoothcomp.calendar.domain.model.FilterOptions;
import com.smoothcomp.calendar.domain.port.out.CacheMetadataRepository;
import com.smoothcomp.calendar.domain.port.out.EventFacet;
import com.smoothcomp.calendar.domain.port.out.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class EventQueryUseCase implements FindEvents {

    private static final Logger logger = LoggerFactory.getLogger(EventQueryUseCase.class);

    private final EventRepository eventRepository;
    private final CacheMetadataRepository metadataRepository;
    private final RefreshEventsUseCase refreshEvents;
    private final Clock clock;

    public EventQueryUseCase(EventRepository eventRepository,
                             CacheMetadataRepository metadataRepository,
                             RefreshEventsUseCase refreshEvents,
                             Clock clock) {
        this.eventRepository = eventRepository;
        this.metadataRepository = metadataRepository;
        this.refreshEvents = refreshEvents;
        this.clock = clock;
    }

    @Override
    public List<Event> findEvents(EventFilter filter) {
        List<Event> events = eventRepository.findEvents(filter);
        logger.debug("Found {} events for {}", events.size(), filter);
        return events;
    }

    @Override
    public List<FacetCount> countries() {
        return eventRepository.countDistinct(EventFacet.COUNTRY, EventFilter.none());
    }

    @Override
    public List<FacetCount> sports() {
        return eventRepository.countDistinct(EventFacet.SPORT, EventFilter.none());
    }

    @Override
    public FilterOptions filterOptions(String country, String sport) {
        EventFilter selection = new EventFilter(country, sport, null);
        long eventCount = eventRepository.countEvents(selection);

        // each dropdown is narrowed by the other one only
        List<FacetCount> sports = selection.hasCountry()
                ? eventRepository.countDistinct(EventFacet.SPORT, new EventFilter(country, null, null))
                : null;
        List<FacetCount> countries = selection.hasSport()
                ? eventRepository.countDistinct(EventFacet.COUNTRY, new EventFilter(null, sport, null))
                : null;

        return new FilterOptions(eventCount, sports, countries);
    }

    @Override
    public CacheStatus status() {
        Optional<Instant> lastUpdate = metadataRepository.findLastUpdate();
        Long ageMinutes = lastUpdate
                .map(last -> Duration.between(last, clock.instant()).toMinutes())
                .orElse(null);

        return new CacheStatus(
                eventRepository.countAll(),
                lastUpdate.orElse(null),
                ageMinutes,
                refreshEvents.ttl().toMinutes(),
                refreshEvents.refreshState().isRunning()
        );
    }
}
