package com.smoothcomp.calendar.domain.model;

public record FacetCount(String value, long count) {}
