package com.chartfeed.data;

import com.chartfeed.exception.InsufficientDataException;
import com.chartfeed.model.Bar;
import com.chartfeed.model.Interval;
import com.chartfeed.model.OhlcvSeries;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates a daily series into coarser fixed buckets.
 *
 * Buckets are right-closed and right-labeled: a bucket is dated by the last day it
 * covers and a bar falls into the first bucket ending on or after its date.
 * <ul>
 *   <li>1-day: passthrough, the input series itself</li>
 *   <li>3-day: consecutive 3-day spans anchored at the first bar's date</li>
 *   <li>1-week: Monday..Sunday, labeled with the Sunday</li>
 * </ul>
 * Per bucket: first open, max high, min low, last close, summed volume.
 */
public final class Resampler {

    private static final int THREE_DAY_SPAN = 3;

    public Resampler() {
    }

    /**
     * @throws InsufficientDataException if aggregation yields no bars
     */
    public OhlcvSeries resample(OhlcvSeries daily, Interval interval) throws InsufficientDataException {
        if (interval == Interval.DAY) {
            return daily;
        }
        if (daily.isEmpty()) {
            throw new InsufficientDataException("no bars to resample for " + daily.datasetId() + " at " + interval);
        }

        LocalDate anchor = daily.firstDate();
        List<Bar> buckets = new ArrayList<>();
        BucketBuilder current = null;

        for (Bar bar : daily.bars()) {
            LocalDate label = bucketLabel(bar.date(), interval, anchor);
            if (current == null || !current.label.equals(label)) {
                if (current != null) {
                    current.buildInto(buckets);
                }
                current = new BucketBuilder(label, bar);
            } else {
                current.add(bar);
            }
        }
        current.buildInto(buckets);

        if (buckets.isEmpty()) {
            throw new InsufficientDataException("no complete bars for " + daily.datasetId() + " at " + interval);
        }
        return OhlcvSeries.of(daily.datasetId(), buckets);
    }

    /**
     * Date of the last day of the bucket containing the given date.
     */
    static LocalDate bucketLabel(LocalDate date, Interval interval, LocalDate anchor) {
        return switch (interval) {
            case DAY -> date;
            case THREE_DAY -> {
                long offset = ChronoUnit.DAYS.between(anchor, date);
                long bucket = Math.floorDiv(offset, THREE_DAY_SPAN);
                yield anchor.plusDays(bucket * THREE_DAY_SPAN + (THREE_DAY_SPAN - 1));
            }
            case WEEK -> date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
        };
    }

    private static final class BucketBuilder {
        private final LocalDate label;
        private final double open;
        private double high;
        private double low;
        private double close;
        private double volume;

        BucketBuilder(LocalDate label, Bar first) {
            this.label = label;
            this.open = first.open();
            this.high = first.high();
            this.low = first.low();
            this.close = first.close();
            this.volume = first.volume();
        }

        void add(Bar bar) {
            high = Math.max(high, bar.high());
            low = Math.min(low, bar.low());
            close = bar.close();
            volume += bar.volume();
        }

        void buildInto(List<Bar> out) {
            // Buckets with an undefined OHLC value are dropped
            if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low) || !Double.isFinite(close)) {
                return;
            }
            out.add(new Bar(label, open, high, low, close, Double.isFinite(volume) ? volume : 0));
        }
    }
}
