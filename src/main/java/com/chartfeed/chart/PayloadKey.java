package com.chartfeed.chart;

import com.chartfeed.model.Interval;

/**
 * Cache key for a composed chart payload.
 */
public record PayloadKey(String datasetId, Interval interval) {

    /**
     * Format: datasetId:interval
     */
    public String toKeyString() {
        return datasetId + ":" + interval.label();
    }
}
