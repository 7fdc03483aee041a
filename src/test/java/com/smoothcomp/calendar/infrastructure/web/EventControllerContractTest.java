package com.smoothcomp.calendar.infrastructure.web;

import com.smoothcomp.calendar.application.FindEvents;
import com.smoothcomp.calendar.application.RefreshEventsUseCase;
import com.smoothcomp.calendar.domain.model.Event;
import com.smoothcomp.calendar.domain.model.EventFilter;
import com.smoothcomp.calendar.domain.model.FacetCount;
import com.smoothcomp.calendar.domain.model.FilterOptions;
import com.smoothcomp.calendar.domain.port.out.EventStoreException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EventController.class)
class EventControllerContractTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FindEvents findEvents;

    @MockBean
    private RefreshEventsUseCase refreshEvents;

    @Test
    void shouldReturnEventsInSnakeCase() throws Exception {
        // Given
        Event event = new Event("123", "Sydney Open", "https://smoothcomp.com/en/event/123",
                Instant.parse("2025-06-01T10:00:00Z"), null, "Olympic Park", "Sydney", "Australia",
                "BJJ", "AFBJJ", 250, true);
        when(findEvents.findEvents(new EventFilter("australia", null, null))).thenReturn(List.of(event));

        // When & Then
        mockMvc.perform(get("/events").param("country", "australia"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.count", is(1)))
                .andExpect(jsonPath("$.filters.country", is("australia")))
                .andExpect(jsonPath("$.filters.sport", nullValue()))
                .andExpect(jsonPath("$.events", hasSize(1)))
                .andExpect(jsonPath("$.events[0].id", is("123")))
                .andExpect(jsonPath("$.events[0].start_date", is("2025-06-01T10:00:00Z")))
                .andExpect(jsonPath("$.events[0].end_date", nullValue()))
                .andExpect(jsonPath("$.events[0].registration_open", is(true)))
                .andExpect(jsonPath("$.events[0].participants", is(250)));

        verify(refreshEvents).maybeRefresh();
    }

    @Test
    void shouldReturnEmptyListWhenNothingMatches() throws Exception {
        when(findEvents.findEvents(any())).thenReturn(List.of());

        mockMvc.perform(get("/events").param("sport", "sumo").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(0)))
                .andExpect(jsonPath("$.events", hasSize(0)));

        verify(findEvents).findEvents(new EventFilter(null, "sumo", 5));
    }

    @Test
    void shouldRejectNonPositiveLimit() throws Exception {
        mockMvc.perform(get("/events").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("invalid_parameter")));

        verify(findEvents, never()).findEvents(any());
        verify(refreshEvents, never()).maybeRefresh();
    }

    @Test
    void shouldRejectNonNumericLimit() throws Exception {
        mockMvc.perform(get("/events").param("limit", "many"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("invalid_parameter")));
    }

    @Test
    void shouldReturnServiceUnavailableWhenStoreFails() throws Exception {
        when(findEvents.findEvents(any())).thenThrow(new EventStoreException("Failed to query events",
                new DataAccessResourceFailureException("connection refused")));

        mockMvc.perform(get("/events"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code", is("store_unavailable")));
    }

    @Test
    void shouldListCountriesWithCounts() throws Exception {
        when(findEvents.countries()).thenReturn(List.of(new FacetCount("Brazil", 12), new FacetCount("Japan", 3)));

        mockMvc.perform(get("/countries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total", is(2)))
                .andExpect(jsonPath("$.countries[0].country", is("Brazil")))
                .andExpect(jsonPath("$.countries[0].count", is(12)))
                .andExpect(jsonPath("$.countries[1].country", is("Japan")));
    }

    @Test
    void shouldListSportsWithCounts() throws Exception {
        when(findEvents.sports()).thenReturn(List.of(new FacetCount("BJJ", 20)));

        mockMvc.perform(get("/sports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total", is(1)))
                .andExpect(jsonPath("$.sports[0].sport", is("BJJ")))
                .andExpect(jsonPath("$.sports[0].count", is(20)));
    }

    @Test
    void shouldOmitUnnarrowedFilterOptionLists() throws Exception {
        when(findEvents.filterOptions("Brazil", null))
                .thenReturn(new FilterOptions(8, List.of(new FacetCount("BJJ", 8)), null));

        mockMvc.perform(get("/filter-options").param("country", "Brazil"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.event_count", is(8)))
                .andExpect(jsonPath("$.sports[0].sport", is("BJJ")))
                .andExpect(jsonPath("$.countries").doesNotExist());
    }

    @Test
    void shouldReturnNotFoundForUnknownPath() throws Exception {
        mockMvc.perform(get("/nowhere"))
                .andExpect(status().isNotFound());
    }
}
