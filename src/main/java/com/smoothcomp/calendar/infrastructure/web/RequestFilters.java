package com.smoothcomp.calendar.infrastructure.web;

import com.smoothcomp.calendar.domain.model.EventFilter;

final class RequestFilters {

    private RequestFilters() {
    }

    /**
     * @throws IllegalArgumentException if {@code limit} is zero or negative
     */
    static EventFilter of(String country, String sport, Integer limit) {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number, got " + limit);
        }
        return new EventFilter(country, sport, limit);
    }
}
