package com.smoothcomp.calendar.infrastructure.web.dto;

public record ErrorResponse(
        String code,
        String message
) {}
