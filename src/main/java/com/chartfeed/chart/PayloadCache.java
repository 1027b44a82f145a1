package com.chartfeed.chart;

import com.chartfeed.exception.ChartFeedException;
import com.chartfeed.model.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Memo table of composed payloads keyed by (dataset id, interval).
 *
 * Concurrent requests for the same key share one in-flight build. Failed builds are
 * not cached. {@link #invalidate(String)} drops every interval of a dataset; a build
 * that was already running when its key was invalidated is handed to its waiters but
 * never served to later requests.
 */
public class PayloadCache {

    private static final Logger log = LoggerFactory.getLogger(PayloadCache.class);

    /**
     * Builds a payload on a cache miss.
     */
    @FunctionalInterface
    public interface Loader {
        ChartPayload load() throws ChartFeedException, IOException;
    }

    private final Map<PayloadKey, CompletableFuture<ChartPayload>> entries = new ConcurrentHashMap<>();

    /**
     * Return the cached payload for the key, building it with the loader on a miss.
     */
    public ChartPayload getOrCompute(PayloadKey key, Loader loader) throws ChartFeedException, IOException {
        CompletableFuture<ChartPayload> created = new CompletableFuture<>();
        CompletableFuture<ChartPayload> existing = entries.putIfAbsent(key, created);

        if (existing == null) {
            log.debug("Cache miss: {}", key.toKeyString());
            try {
                created.complete(loader.load());
            } catch (ChartFeedException | IOException | RuntimeException | Error e) {
                entries.remove(key, created);
                created.completeExceptionally(e);
                throw e;
            }
            return created.join();
        }

        log.debug("Cache hit: {}", key.toKeyString());
        return await(existing);
    }

    private static ChartPayload await(CompletableFuture<ChartPayload> future) throws ChartFeedException, IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for payload build", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ChartFeedException cfe) {
                throw cfe;
            }
            if (cause instanceof IOException ioe) {
                throw ioe;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(cause);
        }
    }

    /**
     * Drop all cached intervals of a dataset.
     */
    public void invalidate(String datasetId) {
        int removed = 0;
        for (Interval interval : Interval.values()) {
            if (entries.remove(new PayloadKey(datasetId, interval)) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Invalidated {} cached payloads for {}", removed, datasetId);
        }
    }

    public void invalidateAll() {
        entries.clear();
    }

    public boolean contains(String datasetId, Interval interval) {
        CompletableFuture<ChartPayload> future = entries.get(new PayloadKey(datasetId, interval));
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    public int size() {
        return entries.size();
    }
}
