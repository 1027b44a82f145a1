package com.chartfeed.indicators;

import com.chartfeed.model.Bar;

import java.util.List;

/**
 * Accumulation/Distribution line: running sum of close-location value times volume.
 */
public final class AccumulationDistribution {

    private AccumulationDistribution() {} // Utility class

    public static double[] calculate(List<Bar> bars) {
        int n = bars.size();
        double[] result = new double[n];
        double cumulative = 0;
        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            cumulative += closeLocationValue(bar) * bar.volume();
            result[i] = cumulative;
        }
        return result;
    }

    /**
     * CLV = ((close - low) - (high - close)) / (high - low), 0 when the bar has no range.
     */
    public static double closeLocationValue(Bar bar) {
        double range = bar.high() - bar.low();
        if (range == 0) {
            return 0;
        }
        return ((bar.close() - bar.low()) - (bar.high() - bar.close())) / range;
    }
}
