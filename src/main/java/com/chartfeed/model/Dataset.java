package com.chartfeed.model;

/**
 * Binds a dataset id to the ticker used for fetching and its classification.
 */
public record Dataset(String id, String ticker, Classification classification) {

    public boolean isCrypto() {
        return classification == Classification.CRYPTO;
    }
}
