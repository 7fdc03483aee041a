package com.smoothcomp.calendar.domain.model;

import java.util.List;

/**
 * Counts for dependent dropdowns. {@code sports} is null unless a country was selected,
 * {@code countries} is null unless a sport was selected.
 */
public record FilterOptions(
        long eventCount,
        List<FacetCount> sports,
        List<FacetCount> countries
) {}
