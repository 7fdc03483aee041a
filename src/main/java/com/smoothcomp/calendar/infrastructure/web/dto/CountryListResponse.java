package com.smoothcomp.calendar.infrastructure.web.dto;

import com.smoothcomp.calendar.domain.model.FacetCount;

import java.util.List;

public record CountryListResponse(
        int total,
        List<CountryCount> countries
) {
    public static CountryListResponse fromFacets(List<FacetCount> facets) {
        var countries = CountryCount.fromFacets(facets);
        return new CountryListResponse(countries.size(), countries);
    }

    public record CountryCount(
            String country,
            long count
    ) {
        static List<CountryCount> fromFacets(List<FacetCount> facets) {
            return facets.stream()
                    .map(f -> new CountryCount(f.value(), f.count()))
                    .toList();
        }
    }
}
