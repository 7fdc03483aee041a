package com.smoothcomp.calendar.domain.port.out;

import com.smoothcomp.calendar.domain.model.Event;
import com.smoothcomp.calendar.domain.model.EventFilter;
import com.smoothcomp.calendar.domain.model.FacetCount;
import com.smoothcomp.calendar.domain.model.RetirementResult;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Repository port for cached events.
 * Every operation is durable and visible to the next read; failures surface as
 * {@link EventStoreException}.
 */
public interface EventRepository {

    /**
     * Ids of every stored event
     */
    Set<String> findExistingIds();

    /**
     * Insert or fully replace an event by id, stamping it with the refresh cycle time.
     * Events that start before the current time are not written.
     *
     * @return true if a row was written
     */
    boolean upsert(Event event, Instant refreshTime);

    /**
     * Delete events not re-observed since {@code refreshTime}, then events that already started.
     */
    RetirementResult retireStale(Instant refreshTime);

    /**
     * Events matching the filter, ascending by start date.
     */
    List<Event> findEvents(EventFilter filter);

    /**
     * Distinct non-empty values of a facet with their counts, restricted by the filter.
     * Sorted by count descending, then value ascending.
     */
    List<FacetCount> countDistinct(EventFacet facet, EventFilter filter);

    long countEvents(EventFilter filter);

    default long countAll() {
        return countEvents(EventFilter.none());
    }
}
