package com.chartfeed.data;

import com.chartfeed.exception.DatasetNotFoundException;
import com.chartfeed.model.Classification;
import com.chartfeed.model.Dataset;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable dataset catalog built once at startup.
 *
 * Source file format (dataset_tickers.json):
 * <pre>
 * { "SAMSUNG_2Y_OHLCV": "005930", "BTCUSDT_2Y_OHLCV": "BTC/USDT" }
 * </pre>
 */
public final class JsonDatasetCatalog implements DatasetCatalog {

    private static final Logger log = LoggerFactory.getLogger(JsonDatasetCatalog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Dataset> datasets;

    private JsonDatasetCatalog(Map<String, Dataset> datasets) {
        this.datasets = Collections.unmodifiableMap(datasets);
    }

    /**
     * Build a catalog from an id -> ticker map.
     */
    public static JsonDatasetCatalog of(Map<String, String> tickers, List<String> cryptoKeywords) {
        Map<String, Dataset> datasets = new TreeMap<>();
        for (var entry : tickers.entrySet()) {
            String id = entry.getKey().trim();
            String ticker = entry.getValue() != null ? entry.getValue().trim() : "";
            if (id.isEmpty() || ticker.isEmpty()) {
                log.warn("Skipping catalog entry with blank id or ticker: {}={}", entry.getKey(), entry.getValue());
                continue;
            }
            datasets.put(id, new Dataset(id, ticker, Classification.classify(id, cryptoKeywords)));
        }
        return new JsonDatasetCatalog(datasets);
    }

    /**
     * Load the catalog from a JSON mapping file.
     *
     * @throws IOException if the file is missing or not a JSON object of strings
     */
    public static JsonDatasetCatalog load(Path file, List<String> cryptoKeywords) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Dataset catalog not found: " + file);
        }
        Map<String, String> tickers;
        try {
            tickers = MAPPER.readValue(file.toFile(), new TypeReference<Map<String, String>>() {});
        } catch (IOException e) {
            throw new IOException("Failed to parse dataset catalog " + file + ": " + e.getMessage(), e);
        }
        JsonDatasetCatalog catalog = of(tickers, cryptoKeywords);
        log.info("Loaded {} datasets from {}", catalog.datasets.size(), file);
        return catalog;
    }

    @Override
    public Dataset resolve(String datasetId) throws DatasetNotFoundException {
        Dataset dataset = datasetId != null ? datasets.get(datasetId) : null;
        if (dataset == null) {
            throw new DatasetNotFoundException(datasetId);
        }
        return dataset;
    }

    @Override
    public boolean contains(String datasetId) {
        return datasetId != null && datasets.containsKey(datasetId);
    }

    @Override
    public List<String> ids() {
        return new ArrayList<>(datasets.keySet());
    }
}
