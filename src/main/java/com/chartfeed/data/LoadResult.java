package com.chartfeed.data;

import com.chartfeed.model.OhlcvSeries;

/**
 * A loaded series plus the number of rows dropped while cleaning it.
 */
public record LoadResult(OhlcvSeries series, int droppedRows) {
}
