package com.chartfeed.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable bar sequence for one dataset.
 *
 * Dates are strictly increasing, so there are never duplicate dates.
 * Read-path components never mutate a series; they build new ones.
 */
public final class OhlcvSeries {

    private final String datasetId;
    private final List<Bar> bars;

    private OhlcvSeries(String datasetId, List<Bar> bars) {
        this.datasetId = datasetId;
        this.bars = bars;
    }

    /**
     * Create a series from bars that are already in ascending date order.
     *
     * @throws IllegalArgumentException if dates are not strictly increasing
     */
    public static OhlcvSeries of(String datasetId, List<Bar> bars) {
        List<Bar> copy = List.copyOf(bars);
        for (int i = 1; i < copy.size(); i++) {
            LocalDate prev = copy.get(i - 1).date();
            LocalDate curr = copy.get(i).date();
            if (!curr.isAfter(prev)) {
                throw new IllegalArgumentException(
                    "Series " + datasetId + " is not strictly increasing at " + curr + " (previous " + prev + ")");
            }
        }
        return new OhlcvSeries(datasetId, copy);
    }

    public static OhlcvSeries empty(String datasetId) {
        return new OhlcvSeries(datasetId, Collections.emptyList());
    }

    public String datasetId() {
        return datasetId;
    }

    public List<Bar> bars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public Bar get(int index) {
        return bars.get(index);
    }

    public Bar first() {
        return bars.isEmpty() ? null : bars.get(0);
    }

    public Bar last() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    /**
     * Date of the newest bar, or null for an empty series.
     */
    public LocalDate lastDate() {
        Bar last = last();
        return last != null ? last.date() : null;
    }

    public LocalDate firstDate() {
        Bar first = first();
        return first != null ? first.date() : null;
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            dates.add(bar.date());
        }
        return dates;
    }

    @Override
    public String toString() {
        return "OhlcvSeries[" + datasetId + ", " + bars.size() + " bars"
            + (bars.isEmpty() ? "" : ", " + firstDate() + ".." + lastDate()) + "]";
    }
}
