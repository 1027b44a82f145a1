package com.chartfeed.exception;

public class DatasetNotFoundException extends ChartFeedException {

    private final String datasetId;

    public DatasetNotFoundException(String datasetId) {
        super(ErrorKind.DATASET_NOT_FOUND, "no dataset '" + datasetId + "'");
        this.datasetId = datasetId;
    }

    public String getDatasetId() {
        return datasetId;
    }
}
