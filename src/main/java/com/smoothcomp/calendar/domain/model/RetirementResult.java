package com.smoothcomp.calendar.domain.model;

/**
 * Rows removed by one retirement pass.
 *
 * @param retiredByAge  events not re-observed by the cycle that just completed
 * @param retiredByDate events whose start date has passed
 */
public record RetirementResult(int retiredByAge, int retiredByDate) {}
