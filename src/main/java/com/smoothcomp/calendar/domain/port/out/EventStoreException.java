package com.smoothcomp.calendar.domain.port.out;

/**
 * The event store could not complete an operation. Already committed rows are unaffected.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
