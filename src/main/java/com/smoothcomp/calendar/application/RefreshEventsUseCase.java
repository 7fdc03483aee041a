package com.smoothcomp.calendar.application;

import com.smoothcomp.calendar.domain.model.Event;
import com.smoothcomp.calendar.domain.model.EventFetchResult;
import com.smoothcomp.calendar.domain.model.RetirementResult;
import com.smoothcomp.calendar.domain.port.out.CacheMetadataRepository;
import com.smoothcomp.calendar.domain.port.out.EventRepository;
import com.smoothcomp.calendar.domain.port.out.ExternalEventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Incremental refresh of the event cache from the source.
 *
 * <p>One cycle fetches the listing, upserts every extractable event page (new ids first)
 * under a shared refresh time, and only after the whole loop succeeded retires rows that
 * were not seen again and records the completion time. A cycle that fails keeps whatever
 * it already upserted and leaves the completion marker untouched, so the next staleness
 * check retries.
 *
 * <p>At most one cycle runs at a time; further triggers while one is running are no-ops.
 */
@Service
public class RefreshEventsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(RefreshEventsUseCase.class);

    private static final int PROGRESS_LOG_INTERVAL = 50;

    private final ExternalEventSource eventSource;
    private final EventRepository eventRepository;
    private final CacheMetadataRepository metadataRepository;
    private final Executor refreshExecutor;
    private final Throttle throttle;
    private final RefreshPolicy policy;
    private final Clock clock;
    private final RefreshState state = new RefreshState();

    public RefreshEventsUseCase(ExternalEventSource eventSource,
                                EventRepository eventRepository,
                                CacheMetadataRepository metadataRepository,
                                @Qualifier("refreshExecutor") Executor refreshExecutor,
                                Throttle throttle,
                                RefreshPolicy policy,
                                Clock clock) {
        this.eventSource = eventSource;
        this.eventRepository = eventRepository;
        this.metadataRepository = metadataRepository;
        this.refreshExecutor = refreshExecutor;
        this.throttle = throttle;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Start a cycle in the background unless one is already running.
     *
     * @return true if a new cycle was started
     */
    public boolean tryStartRefresh() {
        if (!state.tryAcquire(clock.instant())) {
            logger.debug("Refresh already in progress, ignoring trigger");
            return false;
        }

        try {
            refreshExecutor.execute(() -> {
                try {
                    runCycle();
                } finally {
                    state.release();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            state.release();
            logger.error("Refresh executor rejected the cycle", e);
            return false;
        }
    }

    /**
     * Run a cycle on the calling thread unless one is already running.
     *
     * @return the cycle summary, empty if another cycle held the guard
     */
    public Optional<RefreshSummary> refreshIfIdle() {
        if (!state.tryAcquire(clock.instant())) {
            logger.debug("Refresh already in progress, ignoring trigger");
            return Optional.empty();
        }

        try {
            return Optional.of(runCycle());
        } finally {
            state.release();
        }
    }

    /**
     * Start a background cycle if the cache is stale and nothing is running.
     */
    public boolean maybeRefresh() {
        if (state.isRunning()) {
            return false;
        }
        return isStale() && tryStartRefresh();
    }

    public boolean isStale() {
        Optional<Instant> lastUpdate = metadataRepository.findLastUpdate();
        if (lastUpdate.isEmpty()) {
            return true;
        }
        Duration age = Duration.between(lastUpdate.get(), clock.instant());
        return age.compareTo(policy.ttl()) > 0;
    }

    public RefreshState refreshState() {
        return state;
    }

    public Duration ttl() {
        return policy.ttl();
    }

    /**
     * One full cycle. Callers must hold the guard. Never throws: failures are logged and
     * reported through the summary status.
     */
    RefreshSummary runCycle() {
        Instant refreshTime = clock.instant();
        CycleProgress progress = new CycleProgress(refreshTime);

        try {
            Set<String> existingIds = eventRepository.findExistingIds();
            logger.info("Starting refresh at {} ({} existing events, new events first)",
                    refreshTime, existingIds.size());

            List<String> urls;
            try {
                urls = limit(eventSource.listEventReferences());
            } catch (RuntimeException e) {
                logger.error("Refresh aborted, event listing unavailable: {}", e.getMessage(), e);
                return progress.aborted(e);
            }

            RefreshQueue queue = RefreshQueue.partition(urls, existingIds, eventSource::eventIdOf);
            progress.total = queue.size();
            logger.info("Listing has {} events: {} new, {} to update",
                    queue.size(), queue.newUrls().size(), queue.existingUrls().size());

            for (RefreshQueue.Entry entry : queue) {
                process(entry, refreshTime, progress);
                throttle.afterFetch();
                progress.processed++;
                logProgress(progress);
            }

            RetirementResult retirement = eventRepository.retireStale(refreshTime);
            Instant completedAt = metadataRepository.markRefreshComplete();

            logger.info("Refresh complete: {} new, {} updated, {} skipped, {} past, retired {} stale + {} started",
                    progress.newCount, progress.updatedCount, progress.skippedCount, progress.pastCount,
                    retirement.retiredByAge(), retirement.retiredByDate());
            return progress.completed(retirement, completedAt);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Refresh interrupted (keeping {} new events)", progress.newCount);
            return progress.failed(e);
        } catch (Exception e) {
            logger.error("Refresh failed: {} (keeping {} new events)", e.getMessage(), progress.newCount, e);
            return progress.failed(e);
        }
    }

    private void process(RefreshQueue.Entry entry, Instant refreshTime, CycleProgress progress) {
        EventFetchResult result = eventSource.fetchEventDetail(entry.url());
        if (result.event().isEmpty()) {
            progress.skippedCount++;
            logger.debug("Skipping {}: {}", entry.url(), result.skipReason());
            return;
        }

        Event event = result.event().get();
        if (!eventRepository.upsert(event, refreshTime)) {
            progress.pastCount++;
            return;
        }

        if (entry.isNew()) {
            progress.newCount++;
        } else {
            progress.updatedCount++;
        }
    }

    private List<String> limit(List<String> urls) {
        Integer maxEvents = policy.maxEvents();
        if (maxEvents != null && urls.size() > maxEvents) {
            return urls.subList(0, maxEvents);
        }
        return urls;
    }

    private void logProgress(CycleProgress progress) {
        if (progress.processed % PROGRESS_LOG_INTERVAL == 0 || progress.processed == progress.total) {
            logger.info("Progress: {}/{} (new: {}, updated: {})",
                    progress.processed, progress.total, progress.newCount, progress.updatedCount);
        }
    }

    private static final class CycleProgress {
        final Instant refreshTime;
        int total;
        int processed;
        int newCount;
        int updatedCount;
        int skippedCount;
        int pastCount;

        CycleProgress(Instant refreshTime) {
            this.refreshTime = refreshTime;
        }

        RefreshSummary completed(RetirementResult retirement, Instant completedAt) {
            return summary(RefreshSummary.Status.COMPLETED, completedAt, retirement, null);
        }

        RefreshSummary aborted(Exception cause) {
            return summary(RefreshSummary.Status.ABORTED, null, null, cause.getMessage());
        }

        RefreshSummary failed(Exception cause) {
            return summary(RefreshSummary.Status.FAILED, null, null, String.valueOf(cause.getMessage()));
        }

        private RefreshSummary summary(RefreshSummary.Status status, Instant completedAt,
                                       RetirementResult retirement, String error) {
            return new RefreshSummary(status, refreshTime, completedAt, total, newCount, updatedCount,
                    skippedCount, pastCount, retirement, error);
        }
    }
}
