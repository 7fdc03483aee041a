package com.smoothcomp.calendar.infrastructure.cron;

import com.smoothcomp.calendar.application.RefreshEventsUseCase;
import com.smoothcomp.calendar.domain.port.out.EventRepository;
import com.smoothcomp.calendar.infrastructure.config.SmoothcompProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps the cache fresh while the service runs: populates it at startup and re-checks
 * staleness periodically. Not active in static mode.
 */
@Service
@ConditionalOnExpression("${smoothcomp.refresh.scheduler-enabled:true} and !${smoothcomp.static-site.enabled:false}")
public class ScheduledRefreshTrigger {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledRefreshTrigger.class);

    private final RefreshEventsUseCase refreshEvents;
    private final EventRepository eventRepository;
    private final boolean refreshOnStartup;

    public ScheduledRefreshTrigger(RefreshEventsUseCase refreshEvents,
                                   EventRepository eventRepository,
                                   SmoothcompProperties properties) {
        this.refreshEvents = refreshEvents;
        this.eventRepository = eventRepository;
        this.refreshOnStartup = properties.getRefresh().isRefreshOnStartup();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!refreshOnStartup) {
            return;
        }

        try {
            if (refreshEvents.isStale() || eventRepository.countAll() == 0) {
                logger.info("Cache is stale or empty at startup, starting refresh");
                refreshEvents.tryStartRefresh();
            }
        } catch (RuntimeException e) {
            logger.error("Startup refresh check failed, the scheduled check will retry", e);
        }
    }

    @Scheduled(fixedDelayString = "${smoothcomp.refresh.check-interval:60000}",
            initialDelayString = "${smoothcomp.refresh.check-interval:60000}")
    public void checkStaleness() {
        try {
            if (refreshEvents.maybeRefresh()) {
                logger.info("Cache was stale, background refresh started");
            }
        } catch (RuntimeException e) {
            logger.error("Scheduled staleness check failed", e);
        }
    }
}
