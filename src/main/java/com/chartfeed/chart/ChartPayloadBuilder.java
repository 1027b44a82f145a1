package com.chartfeed.chart;

import com.chartfeed.data.Resampler;
import com.chartfeed.data.SeriesChangeListener;
import com.chartfeed.data.SeriesStore;
import com.chartfeed.exception.ChartFeedException;
import com.chartfeed.indicators.IndicatorEngine;
import com.chartfeed.model.Bar;
import com.chartfeed.model.Classification;
import com.chartfeed.model.CloudPoint;
import com.chartfeed.model.DerivedPoint;
import com.chartfeed.model.DerivedSeries;
import com.chartfeed.model.Interval;
import com.chartfeed.model.OhlcvSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes resampled candles, volumes and indicator series into a chart payload.
 *
 * Results are memoized per (dataset, interval). The builder listens for series
 * changes and drops a dataset's cached payloads as soon as a sync rewrites it.
 */
public class ChartPayloadBuilder implements SeriesChangeListener {

    private static final Logger log = LoggerFactory.getLogger(ChartPayloadBuilder.class);

    private final SeriesStore store;
    private final Resampler resampler;
    private final IndicatorEngine indicators;
    private final PayloadCache cache;
    private final List<String> cryptoKeywords;

    public ChartPayloadBuilder(SeriesStore store, Resampler resampler, IndicatorEngine indicators,
                               PayloadCache cache, List<String> cryptoKeywords) {
        this.store = store;
        this.resampler = resampler;
        this.indicators = indicators;
        this.cache = cache;
        this.cryptoKeywords = List.copyOf(cryptoKeywords);
    }

    /**
     * Build (or fetch from cache) the payload for a dataset.
     *
     * @param interval interval label or code; validated before the cache is consulted
     */
    public ChartPayload build(String datasetId, String interval) throws ChartFeedException, IOException {
        return build(datasetId, Interval.parse(interval));
    }

    public ChartPayload build(String datasetId, Interval interval) throws ChartFeedException, IOException {
        return cache.getOrCompute(new PayloadKey(datasetId, interval), () -> compose(datasetId, interval));
    }

    private ChartPayload compose(String datasetId, Interval interval) throws ChartFeedException, IOException {
        OhlcvSeries daily = store.load(datasetId);
        OhlcvSeries working = resampler.resample(daily, interval);
        Classification type = Classification.classify(datasetId, cryptoKeywords);
        List<LocalDate> index = working.dates();

        List<ChartPayload.Candle> candles = new ArrayList<>(working.size());
        List<ChartPayload.Volume> volumes = new ArrayList<>(working.size());
        for (Bar bar : working.bars()) {
            ChartTime time = ChartTime.of(bar.date(), type);
            candles.add(new ChartPayload.Candle(time, bar.open(), bar.high(), bar.low(), bar.close()));
            volumes.add(new ChartPayload.Volume(time, bar.volume(),
                bar.isUp() ? ChartPayload.UP_VOLUME_COLOR : ChartPayload.DOWN_VOLUME_COLOR));
        }

        List<ChartPayload.Value> rsi = align(indicators.rsi(working), index, type, false);
        List<ChartPayload.Value> obv = align(indicators.obv(working), index, type, true);
        List<ChartPayload.Value> ad = align(indicators.accumulationDistribution(working), index, type, true);

        List<ChartPayload.Cloud> cloud = new ArrayList<>();
        for (CloudPoint point : indicators.ichimokuCloud(working)) {
            cloud.add(new ChartPayload.Cloud(ChartTime.of(point.date(), type),
                point.spanA(), point.spanB(), point.top(), point.bottom(),
                point.bullish() ? ChartPayload.CLOUD_BULLISH_COLOR : ChartPayload.CLOUD_BEARISH_COLOR));
        }

        log.info("Built {} payload for {}: {} candles, {} rsi, {} cloud points",
            interval, datasetId, candles.size(), rsi.size(), cloud.size());
        return new ChartPayload(type, candles, volumes, rsi, obv, ad, cloud);
    }

    /**
     * Forward-fill a derived series onto the candle dates.
     * Dates before the first defined value are filled with 0 when {@code zeroLeading},
     * otherwise left out.
     */
    static List<ChartPayload.Value> align(DerivedSeries series, List<LocalDate> index,
                                          Classification type, boolean zeroLeading) {
        List<ChartPayload.Value> aligned = new ArrayList<>(index.size());
        List<DerivedPoint> points = series.points();
        int next = 0;
        Double carried = null;

        for (LocalDate date : index) {
            while (next < points.size() && !points.get(next).date().isAfter(date)) {
                carried = points.get(next).value();
                next++;
            }
            if (carried != null) {
                aligned.add(new ChartPayload.Value(ChartTime.of(date, type), carried));
            } else if (zeroLeading) {
                aligned.add(new ChartPayload.Value(ChartTime.of(date, type), 0.0));
            }
        }
        return aligned;
    }

    @Override
    public void onSeriesChanged(String datasetId, LocalDate lastDate) {
        log.debug("Series {} advanced to {}, dropping cached payloads", datasetId, lastDate);
        cache.invalidate(datasetId);
    }

    public PayloadCache getCache() {
        return cache;
    }
}
