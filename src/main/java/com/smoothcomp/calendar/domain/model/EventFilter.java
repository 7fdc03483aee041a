package com.smoothcomp.calendar.domain.model;

/**
 * Optional query filters. Country and sport match case-insensitively as substrings.
 */
public record EventFilter(
        String country,
        String sport,
        Integer limit
) {

    public static EventFilter none() {
        return new EventFilter(null, null, null);
    }

    public static EventFilter byCountry(String country) {
        return new EventFilter(country, null, null);
    }

    public boolean hasCountry() {
        return country != null && !country.isBlank();
    }

    public boolean hasSport() {
        return sport != null && !sport.isBlank();
    }

    public boolean hasLimit() {
        return limit != null;
    }
}
