package com.smoothcomp.calendar.application;

import java.time.Duration;

/**
 * Rate limit applied after every detail page fetch.
 */
@FunctionalInterface
public interface Throttle {

    void afterFetch() throws InterruptedException;

    static Throttle fixedDelay(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return none();
        }
        long millis = delay.toMillis();
        return () -> Thread.sleep(millis);
    }

    static Throttle none() {
        return () -> {
        };
    }
}
