package com.chartfeed.data;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Per-dataset results of a batch synchronization, in dataset id order.
 */
@JsonPropertyOrder({"status", "rowsAppended", "details"})
public record BatchSyncReport(@JsonProperty("details") List<SyncResult> results) {

    public BatchSyncReport {
        results = List.copyOf(results);
    }

    /**
     * "updated" when any dataset gained rows, otherwise "no_changes".
     */
    @JsonProperty("status")
    public String status() {
        return rowsAppended() > 0 ? "updated" : "no_changes";
    }

    @JsonProperty("rowsAppended")
    public int rowsAppended() {
        return results.stream().mapToInt(SyncResult::rowsAppended).sum();
    }

    public long failureCount() {
        return results.stream().filter(SyncResult::isFailed).count();
    }

    public SyncResult resultFor(String datasetId) {
        for (SyncResult result : results) {
            if (result.datasetId().equals(datasetId)) {
                return result;
            }
        }
        return null;
    }
}
