package com.chartfeed.indicators;

import com.chartfeed.model.Bar;
import com.chartfeed.model.CloudPoint;
import com.chartfeed.model.DerivedPoint;
import com.chartfeed.model.DerivedSeries;
import com.chartfeed.model.OhlcvSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Indicator Engine - dated indicator series over an OHLCV series.
 * Stateless; every call computes fresh output and never touches the input.
 * Warmup rows are dropped, so outputs can be shorter than the input.
 */
public class IndicatorEngine {

    public static final String RSI_NAME = "rsi";
    public static final String OBV_NAME = "obv";
    public static final String AD_NAME = "ad";

    // ========== RSI ==========

    public DerivedSeries rsi(OhlcvSeries series) {
        return rsi(series, RSI.DEFAULT_PERIOD);
    }

    public DerivedSeries rsi(OhlcvSeries series, int period) {
        return toDerived(RSI_NAME, series, RSI.calculate(series.bars(), period));
    }

    // ========== OBV ==========

    public DerivedSeries obv(OhlcvSeries series) {
        return toDerived(OBV_NAME, series, OBV.calculate(series.bars()));
    }

    // ========== Accumulation/Distribution ==========

    public DerivedSeries accumulationDistribution(OhlcvSeries series) {
        return toDerived(AD_NAME, series, AccumulationDistribution.calculate(series.bars()));
    }

    // ========== Ichimoku Cloud ==========

    public List<CloudPoint> ichimokuCloud(OhlcvSeries series) {
        Ichimoku.Result result = Ichimoku.calculate(series.bars());
        List<CloudPoint> points = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            if (!result.isDefined(i)) {
                continue;
            }
            points.add(new CloudPoint(
                series.get(i).date(),
                result.senkouSpanA()[i],
                result.senkouSpanB()[i],
                result.top()[i],
                result.bottom()[i],
                result.isBullish(i)));
        }
        return points;
    }

    /**
     * Pair values with bar dates, skipping NaN (warmup) entries.
     */
    private static DerivedSeries toDerived(String name, OhlcvSeries series, double[] values) {
        List<Bar> bars = series.bars();
        List<DerivedPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                points.add(new DerivedPoint(bars.get(i).date(), values[i]));
            }
        }
        return new DerivedSeries(name, points);
    }
}
