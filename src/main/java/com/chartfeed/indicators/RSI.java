package com.chartfeed.indicators;

import com.chartfeed.model.Bar;

import java.util.Arrays;
import java.util.List;

/**
 * Relative Strength Index indicator.
 *
 * Wilder's smoothing as an exponential average with alpha = 1/period, seeded with the
 * first price change. Values are defined once {@code period} changes have been seen,
 * i.e. from bar index {@code period} onward.
 */
public final class RSI {

    public static final int DEFAULT_PERIOD = 14;

    private RSI() {} // Utility class

    /**
     * Calculate RSI for all bars.
     * @return Array where index corresponds to bar index. Invalid values (warmup period) are Double.NaN.
     */
    public static double[] calculate(List<Bar> bars, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be a positive integer: " + period);
        }
        int n = bars.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (n < 2) {
            return result;
        }

        double alpha = 1.0 / period;
        double avgGain = 0;
        double avgLoss = 0;

        for (int i = 1; i < n; i++) {
            double change = bars.get(i).close() - bars.get(i - 1).close();
            double gain = change > 0 ? change : 0;
            double loss = change < 0 ? -change : 0;

            if (i == 1) {
                avgGain = gain;
                avgLoss = loss;
            } else {
                avgGain = (1 - alpha) * avgGain + alpha * gain;
                avgLoss = (1 - alpha) * avgLoss + alpha * loss;
            }

            if (i >= period) {
                result[i] = fromAverages(avgGain, avgLoss);
            }
        }

        return result;
    }

    public static double[] calculate(List<Bar> bars) {
        return calculate(bars, DEFAULT_PERIOD);
    }

    /**
     * RSI from smoothed averages. No losses means maximum strength (100).
     */
    static double fromAverages(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return 100;
        }
        double rs = avgGain / avgLoss;
        double rsi = 100 - (100 / (1 + rs));
        return Math.max(0, Math.min(100, rsi));
    }
}
