package com.chartfeed.model;

import java.time.LocalDate;

/**
 * One OHLCV period.
 * Daily and weekly bars carry a calendar date only, no time of day.
 */
public record Bar(
    LocalDate date,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    public Bar {
        if (date == null) {
            throw new IllegalArgumentException("Bar date is required");
        }
        if (!Double.isFinite(open) || !Double.isFinite(high)
                || !Double.isFinite(low) || !Double.isFinite(close)) {
            throw new IllegalArgumentException("Bar " + date + " has a non-finite OHLC value");
        }
        if (!Double.isFinite(volume)) {
            volume = 0;
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Bar " + date + " has negative volume " + volume);
        }
    }

    /**
     * Check if this is a bullish bar (close >= open).
     * Flat bars count as up bars when colouring volume.
     */
    public boolean isUp() {
        return close >= open;
    }

    /**
     * Get the range (high - low)
     */
    public double range() {
        return high - low;
    }
}
