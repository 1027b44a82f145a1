package com.chartfeed.chart;

import com.chartfeed.model.Classification;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timestamp of a chart point in the form the client renders for the dataset type:
 * integer Unix seconds (UTC midnight) for crypto, a {year, month, day} object for stocks.
 */
public record ChartTime(LocalDate date, Classification type) {

    public static ChartTime of(LocalDate date, Classification type) {
        return new ChartTime(date, type);
    }

    public long epochSeconds() {
        return date.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }

    @JsonValue
    public Object wireValue() {
        if (type == Classification.CRYPTO) {
            return epochSeconds();
        }
        Map<String, Integer> businessDay = new LinkedHashMap<>();
        businessDay.put("year", date.getYear());
        businessDay.put("month", date.getMonthValue());
        businessDay.put("day", date.getDayOfMonth());
        return businessDay;
    }
}
