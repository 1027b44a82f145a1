package com.chartfeed.model;

import java.util.List;

/**
 * Indicator output with warmup rows already removed.
 * Computed per request and never persisted.
 */
public record DerivedSeries(String name, List<DerivedPoint> points) {

    public DerivedSeries {
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public DerivedPoint get(int index) {
        return points.get(index);
    }
}
