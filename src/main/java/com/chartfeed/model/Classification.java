package com.chartfeed.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Market classification of a dataset.
 * Only affects how chart timestamps are encoded: crypto trades around the clock
 * and gets Unix seconds, session-based stock markets get calendar dates.
 */
public enum Classification {
    STOCK("stock"),
    CRYPTO("crypto");

    private final String wireName;

    Classification(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Classify a dataset id by keyword match (case-insensitive substring).
     */
    public static Classification classify(String datasetId, List<String> cryptoKeywords) {
        String upper = datasetId.toUpperCase(Locale.ROOT);
        for (String keyword : cryptoKeywords) {
            if (!keyword.isBlank() && upper.contains(keyword.toUpperCase(Locale.ROOT))) {
                return CRYPTO;
            }
        }
        return STOCK;
    }
}
