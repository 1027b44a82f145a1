package com.chartfeed.model;

import java.time.LocalDate;

/**
 * Ichimoku cloud value at one bar: both leading spans and the band they form.
 */
public record CloudPoint(
    LocalDate date,
    double spanA,
    double spanB,
    double top,
    double bottom,
    boolean bullish
) {
}
