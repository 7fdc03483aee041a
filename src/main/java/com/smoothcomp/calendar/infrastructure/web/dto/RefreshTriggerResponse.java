package com.smoothcomp.calendar.infrastructure.web.dto;

public record RefreshTriggerResponse(String status) {

    public static RefreshTriggerResponse of(boolean started) {
        return new RefreshTriggerResponse(started ? "accepted" : "already_running");
    }
}
