package com.smoothcomp.calendar.application;

import com.smoothcomp.calendar.domain.model.RetirementResult;

import java.time.Instant;

/**
 * Outcome of one refresh cycle.
 */
public record RefreshSummary(
        Status status,
        Instant refreshTime,
        Instant completedAt,
        int total,
        int newCount,
        int updatedCount,
        int skippedCount,
        int pastCount,
        RetirementResult retirement,
        String error
) {

    public enum Status {
        /** Full loop finished, stale rows retired, completion recorded. */
        COMPLETED,
        /** Listing could not be read; nothing was written. */
        ABORTED,
        /** Died part-way; upserts so far are kept, nothing retired. */
        FAILED
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public int upsertedCount() {
        return newCount + updatedCount;
    }
}
