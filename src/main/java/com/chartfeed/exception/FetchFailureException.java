package com.chartfeed.exception;

public class FetchFailureException extends ChartFeedException {

    private final boolean timeout;

    public FetchFailureException(String message) {
        this(message, null, false);
    }

    public FetchFailureException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private FetchFailureException(String message, Throwable cause, boolean timeout) {
        super(ErrorKind.FETCH_FAILURE, message, cause);
        this.timeout = timeout;
    }

    public static FetchFailureException timeout(String ticker, long timeoutMs) {
        return new FetchFailureException("fetch for " + ticker + " timed out after " + timeoutMs + " ms", null, true);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
