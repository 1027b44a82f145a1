package com.chartfeed.data;

import com.chartfeed.exception.DatasetNotFoundException;
import com.chartfeed.exception.EmptySeriesException;
import com.chartfeed.model.Bar;
import com.chartfeed.model.OhlcvSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Stores and retrieves canonical daily series as CSV files.
 * One file per dataset: DATA_DIR/DATASET_ID.csv with columns date,open,high,low,close,volume.
 *
 * Loading cleans the file: invalid rows are dropped and counted, duplicate dates keep
 * the last occurrence, and rows come back sorted. Saving writes a temp file and then
 * replaces the target, so a crash never leaves a half-written series.
 */
public class SeriesStore {

    private static final Logger log = LoggerFactory.getLogger(SeriesStore.class);
    private static final String EXTENSION = ".csv";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path dataDir;

    public SeriesStore(Path dataDir) throws IOException {
        this.dataDir = dataDir;
        Files.createDirectories(dataDir);
    }

    public Path getDataDir() {
        return dataDir;
    }

    /**
     * Get the series file path for a dataset
     */
    public Path pathFor(String datasetId) {
        return dataDir.resolve(datasetId + EXTENSION);
    }

    public boolean exists(String datasetId) {
        return Files.isRegularFile(pathFor(datasetId));
    }

    /**
     * Dataset ids with a series file, sorted.
     */
    public List<String> listDatasetIds() throws IOException {
        try (Stream<Path> files = Files.list(dataDir)) {
            return files
                .filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .filter(name -> name.toLowerCase().endsWith(EXTENSION))
                .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                .sorted()
                .toList();
        }
    }

    /**
     * Load the cleaned series for a dataset.
     *
     * @throws DatasetNotFoundException if no series file exists
     * @throws EmptySeriesException     if no row survives cleaning
     */
    public OhlcvSeries load(String datasetId) throws DatasetNotFoundException, EmptySeriesException, IOException {
        return loadWithStats(datasetId).series();
    }

    /**
     * Load the cleaned series along with the count of dropped rows.
     */
    public LoadResult loadWithStats(String datasetId)
            throws DatasetNotFoundException, EmptySeriesException, IOException {
        Path file = pathFor(datasetId);
        if (!Files.isRegularFile(file)) {
            throw new DatasetNotFoundException(datasetId);
        }

        TreeMap<LocalDate, Bar> byDate = new TreeMap<>();
        int dropped = 0;
        int duplicates = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            while (header != null && header.isBlank()) {
                header = reader.readLine();
            }
            if (header == null) {
                throw new EmptySeriesException(datasetId, 0);
            }
            ColumnSchema schema = ColumnSchema.resolve(header);

            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;

                Bar bar = schema.parseRow(line);
                if (bar == null) {
                    dropped++;
                    log.debug("[{}] Dropping invalid row: {}", datasetId, line);
                    continue;
                }
                if (byDate.put(bar.date(), bar) != null) {
                    duplicates++;
                }
            }
        }

        if (dropped > 0) {
            log.warn("[{}] Dropped {} invalid rows while loading {}", datasetId, dropped, file.getFileName());
        }
        if (duplicates > 0) {
            log.debug("[{}] Collapsed {} duplicate dates", datasetId, duplicates);
        }
        if (byDate.isEmpty()) {
            throw new EmptySeriesException(datasetId, dropped);
        }

        OhlcvSeries series = OhlcvSeries.of(datasetId, new ArrayList<>(byDate.values()));
        return new LoadResult(series, dropped);
    }

    /**
     * Persist a series, replacing any existing file for the dataset.
     */
    public void save(String datasetId, OhlcvSeries series) throws IOException {
        Path target = pathFor(datasetId);
        Path temp = dataDir.resolve(datasetId + EXTENSION + TEMP_SUFFIX);

        try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            writer.write(ColumnSchema.CANONICAL_HEADER);
            writer.newLine();
            for (Bar bar : series.bars()) {
                writer.write(toCsv(bar));
                writer.newLine();
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Saved {} bars to {}", series.size(), target);
    }

    static String toCsv(Bar bar) {
        return bar.date() + ","
            + format(bar.open()) + ","
            + format(bar.high()) + ","
            + format(bar.low()) + ","
            + format(bar.close()) + ","
            + format(bar.volume());
    }

    private static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
