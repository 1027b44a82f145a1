package com.chartfeed.model;

import java.time.LocalDate;

/**
 * One value of an indicator series, dated like the bar it was computed from.
 */
public record DerivedPoint(LocalDate date, double value) {
}
