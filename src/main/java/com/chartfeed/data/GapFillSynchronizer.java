package com.chartfeed.data;

import com.chartfeed.exception.ChartFeedException;
import com.chartfeed.exception.DatasetNotFoundException;
import com.chartfeed.exception.EmptySeriesException;
import com.chartfeed.exception.FetchFailureException;
import com.chartfeed.model.Bar;
import com.chartfeed.model.Dataset;
import com.chartfeed.model.OhlcvSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Brings a dataset's canonical series up to today by fetching only the missing
 * trailing window.
 *
 * The window is derived from the last stored date and the wall clock, so running
 * twice with no new remote data is a no-op the second time. Writes are serialized
 * per dataset id; different datasets sync in parallel.
 */
public class GapFillSynchronizer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GapFillSynchronizer.class);

    /** Missing trailing window for one dataset, both ends inclusive. */
    public record FetchWindow(LocalDate start, LocalDate end) {
        public boolean contains(LocalDate date) {
            return !date.isBefore(start) && !date.isAfter(end);
        }
    }

    private final SeriesStore store;
    private final DatasetCatalog catalog;
    private final Fetcher fetcher;
    private final Clock clock;
    private final int fallbackDays;
    private final Duration fetchTimeout;
    private final ExecutorService fetchExecutor;
    private final Map<String, ReentrantLock> datasetLocks = new ConcurrentHashMap<>();
    private final List<SeriesChangeListener> listeners = new CopyOnWriteArrayList<>();

    public GapFillSynchronizer(SeriesStore store, DatasetCatalog catalog, Fetcher fetcher,
                               Clock clock, int fallbackDays, Duration fetchTimeout) {
        this.store = store;
        this.catalog = catalog;
        this.fetcher = fetcher;
        this.clock = clock;
        this.fallbackDays = fallbackDays;
        this.fetchTimeout = fetchTimeout;
        this.fetchExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "series-fetch");
            t.setDaemon(true);
            return t;
        });
    }

    public void addChangeListener(SeriesChangeListener listener) {
        listeners.add(listener);
    }

    public void removeChangeListener(SeriesChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Synchronize one dataset by id.
     *
     * @throws DatasetNotFoundException if the catalog has no ticker for the id
     * @throws FetchFailureException    if the remote fetch fails or times out (not retried)
     */
    public SyncResult synchronize(String datasetId) throws ChartFeedException, IOException {
        return synchronize(catalog.resolve(datasetId));
    }

    /**
     * Synchronize one catalogued dataset.
     *
     * @throws EmptySeriesException  if the local file exists but has no valid rows; the file is left as is
     * @throws FetchFailureException if the remote fetch fails or times out
     */
    public SyncResult synchronize(Dataset dataset) throws ChartFeedException, IOException {
        ReentrantLock lock = datasetLocks.computeIfAbsent(dataset.id(), k -> new ReentrantLock());
        lock.lock();
        try {
            return doSynchronize(dataset);
        } finally {
            lock.unlock();
        }
    }

    private SyncResult doSynchronize(Dataset dataset) throws ChartFeedException, IOException {
        String datasetId = dataset.id();
        OhlcvSeries local = loadLocal(datasetId);

        LocalDate today = LocalDate.now(clock);
        FetchWindow window = computeWindow(local.lastDate(), today, fallbackDays);
        if (window == null) {
            log.info("[{}] Already up to date (last {})", datasetId, local.lastDate());
            return SyncResult.upToDate(datasetId);
        }

        log.debug("[{}] Fetching {} from {} to {}", datasetId, dataset.ticker(), window.start(), window.end());
        List<Bar> fetched = fetchWithTimeout(dataset.ticker(), window);

        List<Bar> fresh = clamp(fetched, window);
        if (fresh.isEmpty()) {
            if (!fetched.isEmpty()) {
                log.info("[{}] Remote rows already exist locally ({} outside {}..{})",
                    datasetId, fetched.size(), window.start(), window.end());
            } else {
                log.info("[{}] No new remote rows", datasetId);
            }
            return SyncResult.upToDate(datasetId);
        }

        OhlcvSeries merged = merge(local, fresh);
        store.save(datasetId, merged);
        log.info("[{}] Appended {} new rows (now {} rows, last {})",
            datasetId, fresh.size(), merged.size(), merged.lastDate());

        fireSeriesChanged(datasetId, merged.lastDate());
        return SyncResult.updated(datasetId, fresh);
    }

    /**
     * Local series, or an empty one when the file is absent.
     * A file with no valid rows is never replaced by a fresh download.
     */
    private OhlcvSeries loadLocal(String datasetId) throws EmptySeriesException, IOException {
        try {
            return store.load(datasetId);
        } catch (DatasetNotFoundException e) {
            log.info("[{}] No local series, starting from fallback window", datasetId);
            return OhlcvSeries.empty(datasetId);
        }
    }

    /**
     * Compute the missing trailing window.
     *
     * @param lastLocalDate newest stored date, or null for an empty series
     * @return the window, or null if the series already covers today
     */
    public static FetchWindow computeWindow(LocalDate lastLocalDate, LocalDate today, int fallbackDays) {
        LocalDate start = lastLocalDate != null
            ? lastLocalDate.plusDays(1)
            : today.minusDays(fallbackDays);
        if (start.isAfter(today)) {
            return null;
        }
        return new FetchWindow(start, today);
    }

    /**
     * Keep only fetched bars inside the window, sorted, one per date (last one wins).
     */
    static List<Bar> clamp(List<Bar> fetched, FetchWindow window) {
        TreeMap<LocalDate, Bar> byDate = new TreeMap<>();
        for (Bar bar : fetched) {
            if (bar != null && window.contains(bar.date())) {
                byDate.put(bar.date(), bar);
            }
        }
        return new ArrayList<>(byDate.values());
    }

    /**
     * Merge fetched bars into a local series.
     * On a date collision the fetched bar replaces the local one.
     */
    public static OhlcvSeries merge(OhlcvSeries local, List<Bar> fetched) {
        TreeMap<LocalDate, Bar> byDate = new TreeMap<>();
        for (Bar bar : local.bars()) {
            byDate.put(bar.date(), bar);
        }
        for (Bar bar : fetched) {
            byDate.put(bar.date(), bar);
        }
        return OhlcvSeries.of(local.datasetId(), new ArrayList<>(byDate.values()));
    }

    private List<Bar> fetchWithTimeout(String ticker, FetchWindow window) throws FetchFailureException {
        Future<List<Bar>> future = fetchExecutor.submit(
            () -> fetcher.fetchRange(ticker, window.start(), window.end()));
        try {
            List<Bar> bars = future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return bars != null ? bars : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw FetchFailureException.timeout(ticker, fetchTimeout.toMillis());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new FetchFailureException("fetch for " + ticker + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchFailureException ffe) {
                throw ffe;
            }
            throw new FetchFailureException("fetch for " + ticker + " failed: " + cause.getMessage(), cause);
        }
    }

    private void fireSeriesChanged(String datasetId, LocalDate lastDate) {
        for (SeriesChangeListener listener : listeners) {
            listener.onSeriesChanged(datasetId, lastDate);
        }
    }

    @Override
    public void close() {
        fetchExecutor.shutdownNow();
    }
}
