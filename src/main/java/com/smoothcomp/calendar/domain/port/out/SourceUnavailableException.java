package com.smoothcomp.calendar.domain.port.out;

/**
 * The listing page could not be fetched or did not contain an event list.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
