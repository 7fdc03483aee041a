package com.smoothcomp.calendar.infrastructure.web.dto;

import com.smoothcomp.calendar.domain.model.FacetCount;

import java.util.List;

public record SportListResponse(
        int total,
        List<SportCount> sports
) {
    public static SportListResponse fromFacets(List<FacetCount> facets) {
        var sports = SportCount.fromFacets(facets);
        return new SportListResponse(sports.size(), sports);
    }

    public record SportCount(
            String sport,
            long count
    ) {
        static List<SportCount> fromFacets(List<FacetCount> facets) {
            return facets.stream()
                    .map(f -> new SportCount(f.value(), f.count()))
                    .toList();
        }
    }
}
