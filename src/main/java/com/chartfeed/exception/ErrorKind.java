package com.chartfeed.exception;

/**
 * Failure categories reported to callers. The name doubles as the message prefix.
 */
public enum ErrorKind {
    DATASET_NOT_FOUND("DatasetNotFound"),
    EMPTY_SERIES("EmptySeries"),
    FETCH_FAILURE("FetchFailure"),
    UNSUPPORTED_INTERVAL("UnsupportedInterval"),
    INSUFFICIENT_DATA("InsufficientData"),
    INVALID_ROW("InvalidRow");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
