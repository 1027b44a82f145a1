package com.chartfeed.model;

import com.chartfeed.exception.ErrorKind;
import com.chartfeed.exception.UnsupportedIntervalException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntervalTest {

    @Test
    @DisplayName("Labels and codes resolve, case-insensitively")
    void parsesLabelsAndCodes() throws Exception {
        assertEquals(Interval.DAY, Interval.parse("1-day"));
        assertEquals(Interval.DAY, Interval.parse("1d"));
        assertEquals(Interval.THREE_DAY, Interval.parse("3-day"));
        assertEquals(Interval.THREE_DAY, Interval.parse("3D"));
        assertEquals(Interval.WEEK, Interval.parse(" 1-Week "));
        assertEquals(Interval.WEEK, Interval.parse("1w"));
    }

    @Test
    @DisplayName("Null or blank defaults to 1-day")
    void blankDefaultsToDay() throws Exception {
        assertEquals(Interval.DAY, Interval.parse(null));
        assertEquals(Interval.DAY, Interval.parse("  "));
    }

    @Test
    @DisplayName("Unknown interval fails with UnsupportedInterval")
    void unknownIntervalFails() {
        UnsupportedIntervalException e = assertThrows(UnsupportedIntervalException.class,
            () -> Interval.parse("2d"));
        assertEquals(ErrorKind.UNSUPPORTED_INTERVAL, e.getKind());
        assertTrue(e.getMessage().startsWith("UnsupportedInterval"));
    }

    @Test
    @DisplayName("Crypto keywords classify dataset ids")
    void classifiesByKeyword() {
        List<String> keywords = List.of("USDT", "KRW-");

        assertEquals(Classification.CRYPTO, Classification.classify("ETHUSDT_2Y_OHLCV_Trans", keywords));
        assertEquals(Classification.CRYPTO, Classification.classify("krw-btc_daily", keywords));
        assertEquals(Classification.STOCK, Classification.classify("AAPL_5Y", keywords));
    }
}
