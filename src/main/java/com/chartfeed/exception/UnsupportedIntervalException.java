package com.chartfeed.exception;

public class UnsupportedIntervalException extends ChartFeedException {

    public UnsupportedIntervalException(String interval) {
        super(ErrorKind.UNSUPPORTED_INTERVAL, "'" + interval + "' (supported: 1-day, 3-day, 1-week)");
    }
}
