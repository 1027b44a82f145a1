package com.chartfeed.data;

import com.chartfeed.exception.FetchFailureException;
import com.chartfeed.model.Bar;

import java.time.LocalDate;
import java.util.List;

/**
 * Remote source of daily bars (equity, index or crypto API client).
 * Implementations may return bars outside the requested range; callers clamp.
 */
public interface Fetcher {

    /**
     * Fetch daily bars for a ticker.
     *
     * @param ticker    fetch key from the dataset catalog
     * @param startDate first requested date, inclusive
     * @param endDate   last requested date, inclusive
     * @return bars in any order, possibly empty
     */
    List<Bar> fetchRange(String ticker, LocalDate startDate, LocalDate endDate) throws FetchFailureException;
}
