package com.chartfeed.data;

import com.chartfeed.exception.ChartFeedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Synchronizes every catalogued dataset on a bounded worker pool.
 * Each dataset succeeds or fails on its own; one failure never stops the batch.
 */
public class BatchSynchronizer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchSynchronizer.class);

    private final GapFillSynchronizer synchronizer;
    private final DatasetCatalog catalog;
    private final ExecutorService workers;

    public BatchSynchronizer(GapFillSynchronizer synchronizer, DatasetCatalog catalog, int threads) {
        this.synchronizer = synchronizer;
        this.catalog = catalog;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "series-sync-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Synchronize all datasets in the catalog.
     */
    public BatchSyncReport synchronizeAll() {
        return synchronize(catalog.ids());
    }

    /**
     * Synchronize the given datasets; results come back in the given order.
     */
    public BatchSyncReport synchronize(List<String> datasetIds) {
        Map<String, Future<SyncResult>> pending = new LinkedHashMap<>();
        for (String datasetId : datasetIds) {
            pending.put(datasetId, workers.submit(() -> syncOne(datasetId)));
        }

        List<SyncResult> results = new ArrayList<>();
        for (var entry : pending.entrySet()) {
            results.add(await(entry.getKey(), entry.getValue()));
        }

        BatchSyncReport report = new BatchSyncReport(results);
        log.info("Batch sync finished: {} datasets, {} rows appended, {} failed",
            results.size(), report.rowsAppended(), report.failureCount());
        return report;
    }

    private SyncResult syncOne(String datasetId) {
        try {
            return synchronizer.synchronize(datasetId);
        } catch (ChartFeedException | IOException e) {
            log.warn("[{}] Update failed: {}", datasetId, e.getMessage());
            return SyncResult.failed(datasetId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Update failed unexpectedly", datasetId, e);
            return SyncResult.failed(datasetId, e.toString());
        }
    }

    private SyncResult await(String datasetId, Future<SyncResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return SyncResult.failed(datasetId, "interrupted");
        } catch (ExecutionException e) {
            log.error("[{}] Update task failed", datasetId, e.getCause());
            return SyncResult.failed(datasetId, String.valueOf(e.getCause()));
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
