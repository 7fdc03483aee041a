package com.smoothcomp.calendar.domain.port.out;

import com.smoothcomp.calendar.domain.model.EventFetchResult;

import java.util.List;
import java.util.Optional;

/**
 * Port for the third-party events website.
 * Domain doesn't care about HTTP, HTML or JSON-LD.
 */
public interface ExternalEventSource {

    /**
     * Fetch the ordered event page URLs from the listing page.
     *
     * @throws SourceUnavailableException if the listing cannot be fetched or read
     */
    List<String> listEventReferences();

    /**
     * Fetch and extract one event page. Never throws: network errors, non-200 responses
     * and unreadable pages come back as {@link EventFetchResult#skipped(String)}.
     */
    EventFetchResult fetchEventDetail(String url);

    /**
     * Source-assigned id embedded in an event URL, empty when the URL carries none.
     */
    Optional<String> eventIdOf(String url);
}
