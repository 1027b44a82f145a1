package com.chartfeed.data;

import com.chartfeed.exception.DatasetNotFoundException;
import com.chartfeed.exception.EmptySeriesException;
import com.chartfeed.exception.FetchFailureException;
import com.chartfeed.model.Bar;
import com.chartfeed.model.OhlcvSeries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GapFillSynchronizer window computation, merging and failure handling.
 */
class GapFillSynchronizerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 6);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-06T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private SeriesStore store;
    private DatasetCatalog catalog;
    private FakeFetcher fetcher;
    private GapFillSynchronizer synchronizer;

    /**
     * Serves bars from a fixed list regardless of the requested range, recording each call.
     */
    static class FakeFetcher implements Fetcher {
        final List<Bar> remote = new ArrayList<>();
        final List<LocalDate[]> calls = new ArrayList<>();
        FetchFailureException failure;

        @Override
        public synchronized List<Bar> fetchRange(String ticker, LocalDate start, LocalDate end)
                throws FetchFailureException {
            calls.add(new LocalDate[]{start, end});
            if (failure != null) {
                throw failure;
            }
            return new ArrayList<>(remote);
        }
    }

    private static Bar bar(LocalDate date, double close) {
        return new Bar(date, close, close + 1, close - 1, close, 100);
    }

    private static List<Bar> bars(LocalDate from, LocalDate to, double close) {
        List<Bar> result = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            result.add(bar(d, close));
        }
        return result;
    }

    @BeforeEach
    void setUp() throws Exception {
        store = new SeriesStore(tempDir);
        catalog = JsonDatasetCatalog.of(Map.of("ETHUSDT", "KRW-ETH", "AAPL", "AAPL"), List.of("USDT"));
        fetcher = new FakeFetcher();
        synchronizer = new GapFillSynchronizer(store, catalog, fetcher, CLOCK, 730, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        synchronizer.close();
    }

    private void seedLocal(LocalDate from, LocalDate to) throws Exception {
        store.save("ETHUSDT", OhlcvSeries.of("ETHUSDT", bars(from, to, 10)));
    }

    @Nested
    @DisplayName("Gap fill")
    class GapFillTests {

        @Test
        @DisplayName("Appends only the missing trailing rows")
        void appendsMissingRows() throws Exception {
            seedLocal(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5));
            fetcher.remote.add(bar(TODAY, 20));

            SyncResult result = synchronizer.synchronize("ETHUSDT");

            assertEquals(SyncStatus.UPDATED, result.status());
            assertEquals(1, result.rowsAppended());
            assertEquals(6, store.load("ETHUSDT").size());
            assertEquals(TODAY, store.load("ETHUSDT").lastDate());
            assertArrayEquals(new LocalDate[]{TODAY, TODAY}, fetcher.calls.get(0));
        }

        @Test
        @DisplayName("Second run with no new remote data is a no-op")
        void idempotent() throws Exception {
            seedLocal(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5));
            fetcher.remote.add(bar(TODAY, 20));

            synchronizer.synchronize("ETHUSDT");
            SyncResult second = synchronizer.synchronize("ETHUSDT");

            assertEquals(SyncStatus.UP_TO_DATE, second.status());
            assertEquals(0, second.rowsAppended());
            assertEquals(1, fetcher.calls.size(), "No fetch once the series covers today");
            assertEquals(6, store.load("ETHUSDT").size());
        }

        @Test
        @DisplayName("Rows outside the window are clamped away")
        void clampsOverWideResponse() throws Exception {
            seedLocal(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5));
            fetcher.remote.addAll(bars(LocalDate.of(2024, 1, 4), LocalDate.of(2024, 1, 7), 99));

            SyncResult result = synchronizer.synchronize("ETHUSDT");

            assertEquals(List.of(bar(TODAY, 99)), result.rows());
            OhlcvSeries series = store.load("ETHUSDT");
            assertEquals(6, series.size());
            assertEquals(10.0, series.get(3).close(), "Local row before the window is untouched");
            assertEquals(TODAY, series.lastDate(), "Future row is discarded");
        }

        @Test
        @DisplayName("Remote rows already stored locally yield UP_TO_DATE")
        void overlapOnlyIsUpToDate() throws Exception {
            seedLocal(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5));
            fetcher.remote.addAll(bars(LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 5), 50));

            assertEquals(SyncStatus.UP_TO_DATE, synchronizer.synchronize("ETHUSDT").status());
        }

        @Test
        @DisplayName("No local file fetches the fallback window")
        void fallbackWindow() throws Exception {
            fetcher.remote.addAll(bars(LocalDate.of(2024, 1, 1), TODAY, 10));

            SyncResult result = synchronizer.synchronize("ETHUSDT");

            assertEquals(TODAY.minusDays(730), fetcher.calls.get(0)[0]);
            assertEquals(6, result.rowsAppended());
            assertEquals(6, store.load("ETHUSDT").size());
        }

        @Test
        @DisplayName("Empty remote response leaves the series untouched")
        void emptyResponse() throws Exception {
            seedLocal(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5));

            assertEquals(SyncStatus.UP_TO_DATE, synchronizer.synchronize("ETHUSDT").status());
            assertEquals(5, store.load("ETHUSDT").size());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Fetch failure propagates and the file is untouched")
        void fetchFailure() throws Exception {
            seedLocal(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5));
            fetcher.failure = new FetchFailureException("upstream 503");

            FetchFailureException e = assertThrows(FetchFailureException.class,
                () -> synchronizer.synchronize("ETHUSDT"));

            assertFalse(e.isTimeout());
            assertEquals(5, store.load("ETHUSDT").size());
        }

        @Test
        @DisplayName("Hanging fetch times out")
        void fetchTimeout() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            Fetcher hanging = (ticker, start, end) -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            };

            try (GapFillSynchronizer slow = new GapFillSynchronizer(store, catalog, hanging, CLOCK,
                    730, Duration.ofMillis(100))) {
                FetchFailureException e = assertThrows(FetchFailureException.class,
                    () -> slow.synchronize("ETHUSDT"));
                assertTrue(e.isTimeout());
                assertTrue(e.getMessage().startsWith("FetchFailure"));
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("File with no valid rows fails and is left untouched")
        void unreadableFileKept() throws Exception {
            byte[] original = String.join("\n",
                "date,open,high,low,close,volume",
                "2023/01/02,10,11,9,10.5,100",
                "2023/01/03,10.5,12,10,11,200").getBytes(StandardCharsets.UTF_8);
            Files.write(store.pathFor("ETHUSDT"), original);
            fetcher.remote.add(bar(TODAY, 20));

            assertThrows(EmptySeriesException.class, () -> synchronizer.synchronize("ETHUSDT"));

            assertArrayEquals(original, Files.readAllBytes(store.pathFor("ETHUSDT")));
            assertTrue(fetcher.calls.isEmpty(), "No fetch for a dataset that cannot be loaded");
        }

        @Test
        @DisplayName("Unknown dataset id fails with DatasetNotFound")
        void unknownDataset() {
            assertThrows(DatasetNotFoundException.class, () -> synchronizer.synchronize("NOPE"));
            assertTrue(fetcher.calls.isEmpty());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Concurrent syncs of one dataset run one after the other")
        void serializesPerDataset() throws Exception {
            seedLocal(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5));
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            Fetcher blocking = (ticker, start, end) -> {
                if (calls.incrementAndGet() == 1) {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return List.of(bar(TODAY, 20));
            };

            try (GapFillSynchronizer shared = new GapFillSynchronizer(store, catalog, blocking, CLOCK,
                    730, Duration.ofSeconds(5))) {
                FutureTask<SyncResult> first = new FutureTask<>(() -> shared.synchronize("ETHUSDT"));
                FutureTask<SyncResult> second = new FutureTask<>(() -> shared.synchronize("ETHUSDT"));
                Thread firstThread = new Thread(first, "sync-first");
                Thread secondThread = new Thread(second, "sync-second");

                firstThread.start();
                assertTrue(entered.await(5, TimeUnit.SECONDS));
                secondThread.start();

                // Second caller must park on the dataset lock while the first is mid-fetch
                long deadline = System.currentTimeMillis() + 5000;
                while (secondThread.getState() != Thread.State.WAITING && !second.isDone()
                        && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }
                assertFalse(second.isDone(), "Second sync finished while the first held the dataset");
                assertEquals(1, calls.get());

                release.countDown();
                SyncResult firstResult = first.get(5, TimeUnit.SECONDS);
                SyncResult secondResult = second.get(5, TimeUnit.SECONDS);

                assertEquals(SyncStatus.UPDATED, firstResult.status());
                assertEquals(SyncStatus.UP_TO_DATE, secondResult.status());
                assertEquals(1, calls.get(), "Second sync sees the written series and skips the fetch");
                assertEquals(6, store.load("ETHUSDT").size());
            }
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("Listeners fire after an update, not after a no-op")
        void firesOnUpdateOnly() throws Exception {
            seedLocal(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5));
            fetcher.remote.add(bar(TODAY, 20));
            List<String> events = new ArrayList<>();
            synchronizer.addChangeListener((id, last) -> events.add(id + "@" + last));

            synchronizer.synchronize("ETHUSDT");
            synchronizer.synchronize("ETHUSDT");

            assertEquals(List.of("ETHUSDT@2024-01-06"), events);
        }
    }

    @Nested
    @DisplayName("Window and merge helpers")
    class HelperTests {

        @Test
        @DisplayName("Window starts the day after the last stored date")
        void windowAfterLastDate() {
            GapFillSynchronizer.FetchWindow window =
                GapFillSynchronizer.computeWindow(LocalDate.of(2024, 1, 5), TODAY, 730);

            assertEquals(LocalDate.of(2024, 1, 6), window.start());
            assertEquals(TODAY, window.end());
        }

        @Test
        @DisplayName("No window when the series already covers today")
        void noWindowWhenCurrent() {
            assertNull(GapFillSynchronizer.computeWindow(TODAY, TODAY, 730));
            assertNull(GapFillSynchronizer.computeWindow(TODAY.plusDays(1), TODAY, 730));
        }

        @Test
        @DisplayName("Merge keeps one row per date with the remote row winning")
        void mergeDeduplicates() {
            OhlcvSeries local = OhlcvSeries.of("X", bars(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5), 10));
            List<Bar> remote = bars(LocalDate.of(2024, 1, 4), LocalDate.of(2024, 1, 6), 77);

            OhlcvSeries merged = GapFillSynchronizer.merge(local, remote);

            assertEquals(6, merged.size());
            assertEquals(77.0, merged.get(3).close(), "2024-01-04 comes from the remote side");
            assertEquals(10.0, merged.get(2).close());
        }
    }
}
