package com.chartfeed.data;

import com.chartfeed.exception.FetchFailureException;
import com.chartfeed.model.Bar;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BatchSynchronizer failure isolation and reporting.
 */
class BatchSynchronizerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 1);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T08:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private GapFillSynchronizer synchronizer;
    private BatchSynchronizer batch;

    @BeforeEach
    void setUp() throws Exception {
        SeriesStore store = new SeriesStore(tempDir);
        DatasetCatalog catalog = JsonDatasetCatalog.of(
            Map.of("AAPL", "AAPL", "BROKEN", "BRK", "MSFT", "MSFT"), List.of("USDT"));

        Fetcher fetcher = (ticker, start, end) -> {
            if (ticker.equals("BRK")) {
                throw new FetchFailureException("upstream refused " + ticker);
            }
            if (ticker.equals("MSFT")) {
                return List.of();
            }
            return List.of(new Bar(TODAY.minusDays(1), 10, 11, 9, 10.5, 100),
                           new Bar(TODAY, 10.5, 12, 10, 11.5, 200));
        };

        synchronizer = new GapFillSynchronizer(store, catalog, fetcher, CLOCK, 30, Duration.ofSeconds(5));
        batch = new BatchSynchronizer(synchronizer, catalog, 2);
    }

    @AfterEach
    void tearDown() {
        batch.close();
        synchronizer.close();
    }

    @Test
    @DisplayName("One failing dataset does not stop the others")
    void isolatesFailures() {
        BatchSyncReport report = batch.synchronizeAll();

        assertEquals(3, report.results().size());
        assertEquals(List.of("AAPL", "BROKEN", "MSFT"),
            report.results().stream().map(SyncResult::datasetId).toList());

        assertEquals(SyncStatus.UPDATED, report.resultFor("AAPL").status());
        assertEquals(2, report.resultFor("AAPL").rowsAppended());

        SyncResult broken = report.resultFor("BROKEN");
        assertTrue(broken.isFailed());
        assertTrue(broken.error().contains("upstream refused"));

        assertEquals(SyncStatus.UP_TO_DATE, report.resultFor("MSFT").status());
        assertEquals(1, report.failureCount());
        assertEquals("updated", report.status());
        assertEquals(2, report.rowsAppended());
    }

    @Test
    @DisplayName("Second batch reports no changes")
    void secondRunNoChanges() {
        batch.synchronizeAll();
        BatchSyncReport report = batch.synchronize(List.of("AAPL", "MSFT"));

        assertEquals("no_changes", report.status());
        assertEquals(0, report.rowsAppended());
    }

    @Test
    @DisplayName("Unknown ids are reported as failed")
    void unknownIdFails() {
        BatchSyncReport report = batch.synchronize(List.of("GHOST"));

        assertTrue(report.resultFor("GHOST").error().startsWith("DatasetNotFound"));
    }

    @Test
    @DisplayName("Report serializes with wire names")
    void serializesReport() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        JsonNode json = mapper.readTree(mapper.writeValueAsString(batch.synchronizeAll()));

        assertEquals("updated", json.get("status").asText());
        assertEquals(2, json.get("rowsAppended").asInt());
        assertEquals("AAPL", json.get("details").get(0).get("dataset").asText());
        assertEquals("error", json.get("details").get(1).get("status").asText());
        assertFalse(json.get("details").get(0).has("error"));
    }
}
