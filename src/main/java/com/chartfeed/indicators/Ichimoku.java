package com.chartfeed.indicators;

import com.chartfeed.model.Bar;

import java.util.Arrays;
import java.util.List;

/**
 * Ichimoku Cloud leading spans (Senkou Span A and B).
 *
 * Components:
 * - Conversion Line: (highest high + lowest low) / 2 over conversion period
 * - Base Line: (highest high + lowest low) / 2 over base period
 * - Span A: (Conversion + Base) / 2, shifted displacement bars forward
 * - Span B: (highest high + lowest low) / 2 over span B period, shifted displacement bars forward
 *
 * Shifted values stay on the input timeline: the value at bar i was computed at i - displacement.
 * Default parameters: conversionPeriod=9, basePeriod=26, spanBPeriod=52, displacement=26
 */
public final class Ichimoku {

    public static final int DEFAULT_CONVERSION_PERIOD = 9;
    public static final int DEFAULT_BASE_PERIOD = 26;
    public static final int DEFAULT_SPAN_B_PERIOD = 52;
    public static final int DEFAULT_DISPLACEMENT = 26;

    private Ichimoku() {} // Utility class

    /**
     * Leading spans and the cloud band, index-aligned to the input. NaN where undefined.
     */
    public record Result(
        double[] senkouSpanA,
        double[] senkouSpanB,
        double[] top,
        double[] bottom
    ) {
        /**
         * Both spans defined at this bar.
         */
        public boolean isDefined(int index) {
            return !Double.isNaN(senkouSpanA[index]) && !Double.isNaN(senkouSpanB[index]);
        }

        /**
         * Bullish cloud: span A at or above span B.
         */
        public boolean isBullish(int index) {
            return senkouSpanA[index] >= senkouSpanB[index];
        }
    }

    public static Result calculate(List<Bar> bars) {
        return calculate(bars, DEFAULT_CONVERSION_PERIOD, DEFAULT_BASE_PERIOD,
                        DEFAULT_SPAN_B_PERIOD, DEFAULT_DISPLACEMENT);
    }

    public static Result calculate(List<Bar> bars, int conversionPeriod, int basePeriod,
                                   int spanBPeriod, int displacement) {
        int size = bars.size();

        double[] conversion = midpoints(bars, conversionPeriod);
        double[] base = midpoints(bars, basePeriod);
        double[] spanBSource = midpoints(bars, spanBPeriod);

        double[] spanA = new double[size];
        double[] spanB = new double[size];
        double[] top = new double[size];
        double[] bottom = new double[size];
        Arrays.fill(spanA, Double.NaN);
        Arrays.fill(spanB, Double.NaN);
        Arrays.fill(top, Double.NaN);
        Arrays.fill(bottom, Double.NaN);

        for (int i = 0; i < size; i++) {
            int sourceIndex = i - displacement;
            if (sourceIndex < 0) {
                continue;
            }
            if (!Double.isNaN(conversion[sourceIndex]) && !Double.isNaN(base[sourceIndex])) {
                spanA[i] = (conversion[sourceIndex] + base[sourceIndex]) / 2.0;
            }
            spanB[i] = spanBSource[sourceIndex];

            if (!Double.isNaN(spanA[i]) && !Double.isNaN(spanB[i])) {
                top[i] = Math.max(spanA[i], spanB[i]);
                bottom[i] = Math.min(spanA[i], spanB[i]);
            }
        }

        return new Result(spanA, spanB, top, bottom);
    }

    /**
     * Rolling (highest high + lowest low) / 2, NaN until the window is full.
     */
    static double[] midpoints(List<Bar> bars, int period) {
        int size = bars.size();
        double[] result = new double[size];
        Arrays.fill(result, Double.NaN);

        for (int i = period - 1; i < size; i++) {
            double high = Double.NEGATIVE_INFINITY;
            double low = Double.POSITIVE_INFINITY;
            for (int j = i - period + 1; j <= i; j++) {
                high = Math.max(high, bars.get(j).high());
                low = Math.min(low, bars.get(j).low());
            }
            result[i] = (high + low) / 2.0;
        }
        return result;
    }
}
