package com.smoothcomp.calendar.application;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-flight guard for refresh cycles. Owned by {@link RefreshEventsUseCase};
 * adapters only read it.
 */
public class RefreshState {

    public enum Phase {
        IDLE,
        RUNNING
    }

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Phase phase = Phase.IDLE;
    private volatile Instant startedAt;

    /**
     * Move from IDLE to RUNNING.
     *
     * @return false if a cycle is already running; the caller must not start another
     */
    boolean tryAcquire(Instant now) {
        lock.lock();
        try {
            if (phase == Phase.RUNNING) {
                return false;
            }
            phase = Phase.RUNNING;
            startedAt = now;
            return true;
        } finally {
            lock.unlock();
        }
    }

    void release() {
        lock.lock();
        try {
            phase = Phase.IDLE;
            startedAt = null;
        } finally {
            lock.unlock();
        }
    }

    public Phase phase() {
        return phase;
    }

    public boolean isRunning() {
        return phase == Phase.RUNNING;
    }

    public Optional<Instant> startedAt() {
        return Optional.ofNullable(startedAt);
    }
}
