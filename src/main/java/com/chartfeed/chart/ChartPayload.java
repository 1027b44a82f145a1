package com.chartfeed.chart;

import com.chartfeed.model.Classification;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Composed chart response for one dataset at one interval.
 * Immutable; cached instances are shared between callers.
 */
@JsonPropertyOrder({"type", "candles", "volumes", "rsi", "obv", "ad", "cloud"})
public record ChartPayload(
    Classification type,
    List<Candle> candles,
    List<Volume> volumes,
    List<Value> rsi,
    List<Value> obv,
    List<Value> ad,
    List<Cloud> cloud
) {
    public static final String UP_VOLUME_COLOR = "rgba(8, 153, 129, 0.4)";
    public static final String DOWN_VOLUME_COLOR = "rgba(242, 54, 69, 0.4)";
    public static final String CLOUD_BULLISH_COLOR = "#089981";
    public static final String CLOUD_BEARISH_COLOR = "#f23645";

    public ChartPayload {
        candles = List.copyOf(candles);
        volumes = List.copyOf(volumes);
        rsi = List.copyOf(rsi);
        obv = List.copyOf(obv);
        ad = List.copyOf(ad);
        cloud = List.copyOf(cloud);
    }

    @JsonPropertyOrder({"time", "open", "high", "low", "close"})
    public record Candle(ChartTime time, double open, double high, double low, double close) {}

    @JsonPropertyOrder({"time", "value", "color"})
    public record Volume(ChartTime time, double value, String color) {}

    @JsonPropertyOrder({"time", "value"})
    public record Value(ChartTime time, double value) {}

    @JsonPropertyOrder({"time", "spanA", "spanB", "top", "bottom", "color"})
    public record Cloud(ChartTime time, double spanA, double spanB, double top, double bottom, String color) {}
}
