package com.chartfeed.indicators;

import com.chartfeed.model.Bar;

import java.util.List;

/**
 * On-Balance Volume.
 * Starts at 0 on the first bar; each later bar adds its volume on an up close,
 * subtracts it on a down close and carries the previous value on an unchanged close.
 */
public final class OBV {

    private OBV() {} // Utility class

    public static double[] calculate(List<Bar> bars) {
        int n = bars.size();
        double[] result = new double[n];
        if (n == 0) {
            return result;
        }

        result[0] = 0;
        for (int i = 1; i < n; i++) {
            result[i] = accumulate(result[i - 1], bars.get(i - 1), bars.get(i));
        }
        return result;
    }

    /**
     * One step of the fold: next OBV from the previous value and two consecutive bars.
     */
    public static double accumulate(double previousObv, Bar previous, Bar current) {
        if (current.close() > previous.close()) {
            return previousObv + current.volume();
        }
        if (current.close() < previous.close()) {
            return previousObv - current.volume();
        }
        return previousObv;
    }
}
