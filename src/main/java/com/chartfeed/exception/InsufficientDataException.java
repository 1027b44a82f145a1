package com.chartfeed.exception;

public class InsufficientDataException extends ChartFeedException {

    public InsufficientDataException(String message) {
        super(ErrorKind.INSUFFICIENT_DATA, message);
    }
}
