package com.chartfeed.data;

import java.time.LocalDate;

/**
 * Notified after a dataset's canonical series has been rewritten.
 */
@FunctionalInterface
public interface SeriesChangeListener {

    void onSeriesChanged(String datasetId, LocalDate lastDate);
}
