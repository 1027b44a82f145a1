package com.chartfeed.data;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncStatus {
    UPDATED("updated"),
    UP_TO_DATE("up_to_date"),
    FAILED("error");

    private final String wireName;

    SyncStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
