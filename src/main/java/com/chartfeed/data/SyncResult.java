package com.chartfeed.data;

import com.chartfeed.model.Bar;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Outcome of synchronizing one dataset.
 *
 * @param rows  bars that were appended or replaced, empty unless UPDATED
 * @param error failure message, null unless FAILED
 */
@JsonPropertyOrder({"dataset", "status", "rowsAppended", "rows", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResult(
    @JsonProperty("dataset") String datasetId,
    SyncStatus status,
    List<Bar> rows,
    String error
) {
    public SyncResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static SyncResult updated(String datasetId, List<Bar> rows) {
        return new SyncResult(datasetId, SyncStatus.UPDATED, rows, null);
    }

    public static SyncResult upToDate(String datasetId) {
        return new SyncResult(datasetId, SyncStatus.UP_TO_DATE, List.of(), null);
    }

    public static SyncResult failed(String datasetId, String error) {
        return new SyncResult(datasetId, SyncStatus.FAILED, List.of(), error);
    }

    @JsonProperty("rowsAppended")
    public int rowsAppended() {
        return rows.size();
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == SyncStatus.FAILED;
    }
}
