package com.chartfeed.exception;

public class ChartFeedException extends Exception {

    private final ErrorKind kind;

    public ChartFeedException(ErrorKind kind, String message) {
        super(kind.displayName() + ": " + message);
        this.kind = kind;
    }

    public ChartFeedException(ErrorKind kind, String message, Throwable cause) {
        super(kind.displayName() + ": " + message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
