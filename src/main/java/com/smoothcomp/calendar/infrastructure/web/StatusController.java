package com.smoothcomp.calendar.infrastructure.web;

import com.smoothcomp.calendar.application.FindEvents;
import com.smoothcomp.calendar.application.RefreshEventsUseCase;
import com.smoothcomp.calendar.infrastructure.web.dto.RefreshTriggerResponse;
import com.smoothcomp.calendar.infrastructure.web.dto.StatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cache status (doubles as health check) and the manual refresh trigger.
 */
@RestController
public class StatusController {

    private static final Logger logger = LoggerFactory.getLogger(StatusController.class);

    private final FindEvents findEvents;
    private final RefreshEventsUseCase refreshEvents;

    public StatusController(FindEvents findEvents, RefreshEventsUseCase refreshEvents) {
        this.findEvents = findEvents;
        this.refreshEvents = refreshEvents;
    }

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> getStatus() {
        return ResponseEntity.ok(StatusResponse.fromStatus(findEvents.status()));
    }

    @PostMapping("/refresh")
    public ResponseEntity<RefreshTriggerResponse> triggerRefresh() {
        boolean started = refreshEvents.tryStartRefresh();
        logger.info("Manual refresh requested: {}", started ? "started" : "already running");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RefreshTriggerResponse.of(started));
    }
}
