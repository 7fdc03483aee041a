package com.smoothcomp.calendar.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smoothcomp.calendar.domain.model.FilterOptions;

import java.util.List;

/**
 * Dropdown contents for the landing page. Each list is omitted unless the other
 * dropdown has a selection.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterOptionsResponse(
        long event_count,
        List<SportListResponse.SportCount> sports,
        List<CountryListResponse.CountryCount> countries
) {
    public static FilterOptionsResponse fromOptions(FilterOptions options) {
        return new FilterOptionsResponse(
                options.eventCount(),
                options.sports() == null ? null : SportListResponse.SportCount.fromFacets(options.sports()),
                options.countries() == null ? null : CountryListResponse.CountryCount.fromFacets(options.countries())
        );
    }
}
