package com.smoothcomp.calendar.application;

import com.smoothcomp.calendar.domain.model.CacheStatus;
import com.smoothcomp.calendar.domain.model.Event;
import com.smoothcomp.calendar.domain.model.EventFilter;
import com.smoothcomp.calendar.domain.model.FacetCount;
import com.smoothcomp.calendar.domain.model.FilterOptions;

import java.util.List;

/**
 * Read side of the event cache.
 * Readers never wait for a running refresh and may see a partially refreshed store.
 */
public interface FindEvents {

    /**
     * Events matching the filter, ascending by start date.
     *
     * @param filter country/sport substring filters and optional limit
     * @return matching events, possibly empty
     */
    List<Event> findEvents(EventFilter filter);

    List<FacetCount> countries();

    List<FacetCount> sports();

    /**
     * Event count for the current selection, with the sports available in the selected
     * country and the countries available for the selected sport.
     */
    FilterOptions filterOptions(String country, String sport);

    CacheStatus status();
}
