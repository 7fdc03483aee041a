package com.smoothcomp.calendar.domain.port.out;

/**
 * Event attributes that can be grouped and counted.
 */
public enum EventFacet {
    COUNTRY("country"),
    SPORT("sport");

    private final String column;

    EventFacet(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
