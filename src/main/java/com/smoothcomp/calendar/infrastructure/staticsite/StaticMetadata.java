package com.smoothcomp.calendar.infrastructure.staticsite;

import java.util.List;

/**
 * Contents of {@code metadata.json}, read by the static landing page.
 */
public record StaticMetadata(
        String generated_at,
        int total_events,
        List<CountryEntry> countries
) {
    public record CountryEntry(
            String name,
            String slug,
            int count
    ) {}
}
