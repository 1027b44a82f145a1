package com.chartfeed.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration for the chart feed pipeline.
 * Values come from system properties, then environment variables, then defaults.
 */
public class ChartFeedConfig {
    private static final String DEFAULT_DATA_DIR = System.getProperty("user.home") + "/.chartfeed/stock_data";
    private static final String CATALOG_FILE_NAME = "dataset_tickers.json";
    private static final int DEFAULT_FALLBACK_DAYS = 730;
    private static final int DEFAULT_SYNC_THREADS = 3;
    private static final long DEFAULT_FETCH_TIMEOUT_SECONDS = 60;
    private static final String DEFAULT_DATASET_ID = "ETHUSDT_2Y_OHLCV_Trans";
    private static final String DEFAULT_CRYPTO_KEYWORDS = "USDT,USDC,BTC,ETH,KRW-,CRYPTO";

    private final Path dataDir;
    private final Path catalogFile;
    private final int fallbackDays;
    private final int syncThreads;
    private final Duration fetchTimeout;
    private final String defaultDatasetId;
    private final List<String> cryptoKeywords;

    public ChartFeedConfig(Path dataDir, Path catalogFile, int fallbackDays, int syncThreads,
                           Duration fetchTimeout, String defaultDatasetId, List<String> cryptoKeywords) {
        if (fallbackDays <= 0) {
            throw new IllegalArgumentException("fallbackDays must be positive: " + fallbackDays);
        }
        if (syncThreads <= 0) {
            throw new IllegalArgumentException("syncThreads must be positive: " + syncThreads);
        }
        if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be positive: " + fetchTimeout);
        }
        this.dataDir = dataDir;
        this.catalogFile = catalogFile != null ? catalogFile : dataDir.resolve(CATALOG_FILE_NAME);
        this.fallbackDays = fallbackDays;
        this.syncThreads = syncThreads;
        this.fetchTimeout = fetchTimeout;
        this.defaultDatasetId = defaultDatasetId;
        this.cryptoKeywords = List.copyOf(cryptoKeywords);
    }

    public static ChartFeedConfig load() {
        Path dataDir = Paths.get(setting("chartfeed.data.dir", "CHARTFEED_DATA_DIR", DEFAULT_DATA_DIR));

        String catalogStr = setting("chartfeed.catalog.file", "CHARTFEED_CATALOG_FILE", null);
        Path catalogFile = catalogStr != null ? Paths.get(catalogStr) : null;

        int fallbackDays = Integer.parseInt(setting("chartfeed.fallback_days", "CHARTFEED_FALLBACK_DAYS",
            String.valueOf(DEFAULT_FALLBACK_DAYS)));

        int syncThreads = Integer.parseInt(setting("chartfeed.sync.threads", "CHARTFEED_SYNC_THREADS",
            String.valueOf(DEFAULT_SYNC_THREADS)));

        long timeoutSeconds = Long.parseLong(setting("chartfeed.fetch.timeout_seconds",
            "CHARTFEED_FETCH_TIMEOUT_SECONDS", String.valueOf(DEFAULT_FETCH_TIMEOUT_SECONDS)));

        String defaultDataset = setting("chartfeed.default_dataset", "CHARTFEED_DEFAULT_DATASET",
            DEFAULT_DATASET_ID);

        List<String> keywords = parseKeywords(setting("chartfeed.crypto_keywords", "CHARTFEED_CRYPTO_KEYWORDS",
            DEFAULT_CRYPTO_KEYWORDS));

        return new ChartFeedConfig(dataDir, catalogFile, fallbackDays, syncThreads,
            Duration.ofSeconds(timeoutSeconds), defaultDataset, keywords);
    }

    /**
     * Defaults rooted at the given data directory. Used by tests and embedders.
     */
    public static ChartFeedConfig forDataDir(Path dataDir) {
        return new ChartFeedConfig(dataDir, null, DEFAULT_FALLBACK_DAYS, DEFAULT_SYNC_THREADS,
            Duration.ofSeconds(DEFAULT_FETCH_TIMEOUT_SECONDS), DEFAULT_DATASET_ID,
            parseKeywords(DEFAULT_CRYPTO_KEYWORDS));
    }

    private static String setting(String property, String env, String defaultValue) {
        return System.getProperty(property, System.getenv().getOrDefault(env, defaultValue));
    }

    static List<String> parseKeywords(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getCatalogFile() {
        return catalogFile;
    }

    public int getFallbackDays() {
        return fallbackDays;
    }

    public int getSyncThreads() {
        return syncThreads;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public String getDefaultDatasetId() {
        return defaultDatasetId;
    }

    public List<String> getCryptoKeywords() {
        return cryptoKeywords;
    }

    public ChartFeedConfig withFetchTimeout(Duration timeout) {
        return new ChartFeedConfig(dataDir, catalogFile, fallbackDays, syncThreads, timeout,
            defaultDatasetId, cryptoKeywords);
    }

    public ChartFeedConfig withDefaultDatasetId(String datasetId) {
        return new ChartFeedConfig(dataDir, catalogFile, fallbackDays, syncThreads, fetchTimeout,
            datasetId, cryptoKeywords);
    }
}
