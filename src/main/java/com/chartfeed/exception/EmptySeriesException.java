package com.chartfeed.exception;

public class EmptySeriesException extends ChartFeedException {

    private final int droppedRows;

    public EmptySeriesException(String datasetId, int droppedRows) {
        super(ErrorKind.EMPTY_SERIES, "dataset '" + datasetId + "' has no valid rows ("
            + droppedRows + " invalid rows dropped)");
        this.droppedRows = droppedRows;
    }

    public int getDroppedRows() {
        return droppedRows;
    }
}
