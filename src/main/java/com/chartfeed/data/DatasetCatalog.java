package com.chartfeed.data;

import com.chartfeed.exception.DatasetNotFoundException;
import com.chartfeed.model.Dataset;

import java.util.List;

/**
 * Lookup from dataset id to ticker and classification.
 */
public interface DatasetCatalog {

    Dataset resolve(String datasetId) throws DatasetNotFoundException;

    boolean contains(String datasetId);

    /**
     * All known dataset ids in ascending order.
     */
    List<String> ids();
}
