package com.chartfeed.model;

import com.chartfeed.exception.UnsupportedIntervalException;

import java.util.Locale;

/**
 * Chart resolutions served from the canonical daily series.
 */
public enum Interval {
    DAY("1-day", "1d"),
    THREE_DAY("3-day", "3d"),
    WEEK("1-week", "1w");

    private final String label;
    private final String code;

    Interval(String label, String code) {
        this.label = label;
        this.code = code;
    }

    public String label() {
        return label;
    }

    public String code() {
        return code;
    }

    /**
     * Resolve an interval from its label ("1-week") or short code ("1w").
     * Null or blank input resolves to {@link #DAY}.
     *
     * @throws UnsupportedIntervalException for anything else
     */
    public static Interval parse(String text) throws UnsupportedIntervalException {
        if (text == null || text.isBlank()) {
            return DAY;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (Interval interval : values()) {
            if (interval.label.equals(normalized) || interval.code.equals(normalized)) {
                return interval;
            }
        }
        throw new UnsupportedIntervalException(text);
    }

    @Override
    public String toString() {
        return label;
    }
}
