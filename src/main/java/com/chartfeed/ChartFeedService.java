package com.chartfeed;

import com.chartfeed.chart.ChartPayload;
import com.chartfeed.chart.ChartPayloadBuilder;
import com.chartfeed.chart.PayloadCache;
import com.chartfeed.config.ChartFeedConfig;
import com.chartfeed.data.BatchSyncReport;
import com.chartfeed.data.BatchSynchronizer;
import com.chartfeed.data.DatasetCatalog;
import com.chartfeed.data.Fetcher;
import com.chartfeed.data.GapFillSynchronizer;
import com.chartfeed.data.JsonDatasetCatalog;
import com.chartfeed.data.LoadResult;
import com.chartfeed.data.Resampler;
import com.chartfeed.data.SeriesStore;
import com.chartfeed.data.SyncResult;
import com.chartfeed.exception.ChartFeedException;
import com.chartfeed.exception.DatasetNotFoundException;
import com.chartfeed.indicators.IndicatorEngine;
import com.chartfeed.model.OhlcvSeries;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the chart feed pipeline.
 *
 * Wires the series store, synchronizers and payload builder together and exposes
 * the four operations an outer surface (HTTP, CLI) needs: list datasets, get a chart
 * payload, sync one dataset, sync everything.
 */
public class ChartFeedService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChartFeedService.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final ChartFeedConfig config;
    private final SeriesStore store;
    private final DatasetCatalog catalog;
    private final GapFillSynchronizer synchronizer;
    private final BatchSynchronizer batchSynchronizer;
    private final ChartPayloadBuilder payloadBuilder;
    private final ObjectMapper mapper;

    /**
     * One row of the dataset listing.
     */
    @JsonPropertyOrder({"id", "label", "rows", "range", "default"})
    public record DatasetSummary(
        String id,
        String label,
        @JsonProperty("rows") int rowCount,
        @JsonProperty("range") String dateRange,
        @JsonProperty("default") boolean isDefault
    ) {}

    public ChartFeedService(ChartFeedConfig config, SeriesStore store, DatasetCatalog catalog,
                            Fetcher fetcher, Clock clock) {
        this.config = config;
        this.store = store;
        this.catalog = catalog;
        this.synchronizer = new GapFillSynchronizer(store, catalog, fetcher, clock,
            config.getFallbackDays(), config.getFetchTimeout());
        this.batchSynchronizer = new BatchSynchronizer(synchronizer, catalog, config.getSyncThreads());
        this.payloadBuilder = new ChartPayloadBuilder(store, new Resampler(), new IndicatorEngine(),
            new PayloadCache(), config.getCryptoKeywords());
        this.synchronizer.addChangeListener(payloadBuilder);

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Build a service from configuration, loading the ticker catalog from
     * {@link ChartFeedConfig#getCatalogFile()}. A missing catalog file yields an empty
     * catalog: charts still work, syncs report every dataset as unknown.
     */
    public static ChartFeedService create(ChartFeedConfig config, Fetcher fetcher, Clock clock) throws IOException {
        SeriesStore store = new SeriesStore(config.getDataDir());
        DatasetCatalog catalog;
        if (Files.exists(config.getCatalogFile())) {
            catalog = JsonDatasetCatalog.load(config.getCatalogFile(), config.getCryptoKeywords());
        } else {
            log.warn("Ticker catalog not found at {}, starting with an empty catalog", config.getCatalogFile());
            catalog = JsonDatasetCatalog.of(Map.of(), config.getCryptoKeywords());
        }
        return new ChartFeedService(config, store, catalog, fetcher, clock);
    }

    // ========== Listing ==========

    /**
     * Every dataset with a series file, sorted by id. Unloadable datasets are skipped.
     */
    public List<DatasetSummary> listDatasets() throws IOException {
        List<String> ids = store.listDatasetIds();
        String defaultId = ids.contains(config.getDefaultDatasetId())
            ? config.getDefaultDatasetId()
            : ids.isEmpty() ? null : ids.get(0);

        List<DatasetSummary> summaries = new ArrayList<>();
        for (String id : ids) {
            LoadResult loaded;
            try {
                loaded = store.loadWithStats(id);
            } catch (ChartFeedException | IOException e) {
                log.warn("Skipping dataset {}: {}", id, e.toString());
                continue;
            }
            OhlcvSeries series = loaded.series();
            summaries.add(new DatasetSummary(
                id,
                labelFor(id),
                series.size(),
                DATE_FORMAT.format(series.firstDate()) + " ~ " + DATE_FORMAT.format(series.lastDate()),
                id.equals(defaultId)));
        }
        return summaries;
    }

    /**
     * Map a requested id to a known dataset; null or blank picks the default.
     */
    public String resolveDatasetId(String requested) throws DatasetNotFoundException, IOException {
        if (requested == null || requested.isBlank()) {
            List<String> ids = store.listDatasetIds();
            if (ids.contains(config.getDefaultDatasetId()) || ids.isEmpty()) {
                return config.getDefaultDatasetId();
            }
            return ids.get(0);
        }
        String id = requested.trim();
        if (!store.exists(id) && !catalog.contains(id)) {
            throw new DatasetNotFoundException(id);
        }
        return id;
    }

    static String labelFor(String datasetId) {
        return datasetId.replace('_', ' ');
    }

    // ========== Charts ==========

    /**
     * Chart payload for a dataset at an interval label or code (null means daily).
     */
    public ChartPayload getPayload(String datasetId, String interval) throws ChartFeedException, IOException {
        return payloadBuilder.build(resolveDatasetId(datasetId), interval);
    }

    public String getPayloadJson(String datasetId, String interval) throws ChartFeedException, IOException {
        return toJson(getPayload(datasetId, interval));
    }

    // ========== Sync ==========

    public SyncResult sync(String datasetId) throws ChartFeedException, IOException {
        return synchronizer.synchronize(datasetId);
    }

    public BatchSyncReport syncAll() {
        return batchSynchronizer.synchronizeAll();
    }

    public String toJson(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    public PayloadCache getPayloadCache() {
        return payloadBuilder.getCache();
    }

    public SeriesStore getStore() {
        return store;
    }

    @Override
    public void close() {
        batchSynchronizer.close();
        synchronizer.close();
    }
}
