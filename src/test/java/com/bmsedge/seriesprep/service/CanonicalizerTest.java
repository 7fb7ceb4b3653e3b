package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.config.PipelineProperties;
import com.bmsedge.seriesprep.exception.PipelineCancelledException;
import com.bmsedge.seriesprep.model.CanonicalRow;
import com.bmsedge.seriesprep.model.CanonicalizationResult;
import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.ColumnKind;
import com.bmsedge.seriesprep.model.DiagnosticEntry;
import com.bmsedge.seriesprep.model.DiagnosticReason;
import com.bmsedge.seriesprep.model.MappingSpec;
import com.bmsedge.seriesprep.model.RawColumn;
import com.bmsedge.seriesprep.model.RawTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Canonicalizer, sequential and sharded
 */
class CanonicalizerTest {

    private PipelineProperties properties;
    private Canonicalizer canonicalizer;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        canonicalizer = new Canonicalizer(properties, null);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("Should emit one canonical row per cleanly parsed long row")
    void shouldCanonicalizeLongRow() {
        // Arrange
        RawTable table = RawTable.builder()
                .column("store_id", ColumnKind.TEXT, "A")
                .column("date", ColumnKind.TEXT, "2024-01-08")
                .column("sales", ColumnKind.INTEGER, 100)
                .build();
        MappingSpec mapping = MappingSpec.longFormat(Collections.singletonList("store_id"), "|", "date", "sales");

        // Act
        CanonicalizationResult result = canonicalizer.canonicalize(table, null, mapping);

        // Assert
        assertEquals(Collections.singletonList(new CanonicalRow("A", LocalDate.of(2024, 1, 8), 100.0)),
                result.getRows());
        assertEquals(0, result.getDiagnostics().getTotalIssues());
    }

    @Test
    @DisplayName("Should drop rows that fail to parse and record each reason")
    void shouldRecordLongParseFailures() {
        // Arrange
        RawTable table = RawTable.builder()
                .column("store_id", ColumnKind.TEXT, "A", "A", "B", "B", "C")
                .column("date", ColumnKind.TEXT, "2024-01-01", "someday", "2024-01-01", null, "2024-01-03")
                .column("sales", ColumnKind.TEXT, "10", "11", "lots", "13", "NaN")
                .build();
        MappingSpec mapping = MappingSpec.longFormat(Collections.singletonList("store_id"), "|", "date", "sales");

        // Act
        CanonicalizationResult result = canonicalizer.canonicalize(table, null, mapping);

        // Assert: injective over clean rows
        assertEquals(1, result.getRows().size());
        assertEquals(1, result.getDiagnostics().count(DiagnosticReason.UNPARSEABLE_DATE));
        assertEquals(1, result.getDiagnostics().count(DiagnosticReason.NON_NUMERIC_VALUE));
        assertEquals(1, result.getDiagnostics().count(DiagnosticReason.NULL_VALUE));
        assertEquals(1, result.getDiagnostics().count(DiagnosticReason.NON_FINITE_VALUE));

        DiagnosticEntry badDate = result.getDiagnostics().samplesFor(DiagnosticReason.UNPARSEABLE_DATE).get(0);
        assertEquals(Integer.valueOf(1), badDate.getRowIndex());
        assertEquals("date", badDate.getColumn());
        assertEquals("someday", badDate.getRawValue());
        assertEquals("A", badDate.getCdKey());
    }

    @Test
    @DisplayName("Should expand wide rows into one row per date header")
    void shouldCanonicalizeWideTable() {
        // Arrange
        RawTable table = RawTable.builder()
                .column("Store", ColumnKind.TEXT, "A", "B")
                .column("Jan-2024", ColumnKind.INTEGER, 10, 5)
                .column("Feb-2024", ColumnKind.INTEGER, 12, 7)
                .build();
        MappingSpec mapping = MappingSpec.wideFormat(Collections.singletonList("Store"), "|",
                Arrays.asList("Jan-2024", "Feb-2024"));

        // Act
        CanonicalizationResult result = canonicalizer.canonicalize(table, null, mapping);

        // Assert: K x H rows when every cell parses
        assertEquals(4, result.getRows().size());
        assertTrue(result.getRows().contains(new CanonicalRow("A", LocalDate.of(2024, 1, 1), 10.0)));
        assertTrue(result.getRows().contains(new CanonicalRow("A", LocalDate.of(2024, 2, 1), 12.0)));
        assertTrue(result.getRows().contains(new CanonicalRow("B", LocalDate.of(2024, 1, 1), 5.0)));
        assertTrue(result.getRows().contains(new CanonicalRow("B", LocalDate.of(2024, 2, 1), 7.0)));
    }

    @Test
    @DisplayName("Should skip a whole column with an unparseable header and record it once")
    void shouldSkipUnparseableHeader() {
        // Arrange
        RawTable table = RawTable.builder()
                .column("Store", ColumnKind.TEXT, "A", "B", "C")
                .column("Jan-2024", ColumnKind.TEXT, "1", "", "x")
                .column("Total", ColumnKind.INTEGER, 9, 9, 9)
                .build();
        MappingSpec mapping = MappingSpec.wideFormat(Collections.singletonList("Store"), "|",
                Arrays.asList("Jan-2024", "Total"));

        // Act
        CanonicalizationResult result = canonicalizer.canonicalize(table, null, mapping);

        // Assert: bad cells skip only themselves
        assertEquals(1, result.getRows().size());
        assertEquals(1, result.getDiagnostics().count(DiagnosticReason.UNPARSEABLE_HEADER));
        assertEquals("Total", result.getDiagnostics().samplesFor(DiagnosticReason.UNPARSEABLE_HEADER).get(0).getColumn());
        assertEquals(1, result.getDiagnostics().count(DiagnosticReason.NULL_VALUE));
        assertEquals(1, result.getDiagnostics().count(DiagnosticReason.NON_NUMERIC_VALUE));
    }

    @Test
    @DisplayName("Should join trimmed key parts in mapping order with the null token for missing parts")
    void shouldBuildCompositeKeys() {
        // Arrange
        properties.setNullKeyToken("NA");
        RawTable table = RawTable.builder()
                .column("region", ColumnKind.TEXT, " North ", null)
                .column("store", ColumnKind.INTEGER, 7, 8)
                .column("date", ColumnKind.TEXT, "2024-01-01", "2024-01-01")
                .column("y", ColumnKind.INTEGER, 1, 2)
                .build();
        MappingSpec mapping = MappingSpec.longFormat(Arrays.asList("store", "region"), "|", "date", "y");

        // Act
        CanonicalizationResult result = canonicalizer.canonicalize(table, null, mapping);

        // Assert
        assertEquals("7|North", result.getRows().get(0).getCdKey());
        assertEquals("8|NA", result.getRows().get(1).getCdKey());
    }

    @Test
    @DisplayName("Should return the same rows whether run sequentially or in shards")
    void shouldMatchSequentialWhenSharded() {
        // Arrange
        RawTable longTable = generatedLongTable(50);
        MappingSpec longMapping = MappingSpec.longFormat(Collections.singletonList("key"), "|", "date", "value");
        RawTable wideTable = generatedWideTable(7, 9);
        List<String> headers = new ArrayList<>(wideTable.getColumnNames().subList(1, 10));
        MappingSpec wideMapping = MappingSpec.wideFormat(Collections.singletonList("key"), "|", headers);

        CanonicalizationResult longSequential = canonicalizer.canonicalize(longTable, null, longMapping);
        CanonicalizationResult wideSequential = canonicalizer.canonicalize(wideTable, null, wideMapping);

        properties.setParallelThreshold(10);
        properties.setShardSize(8);
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(3);
        executor.initialize();
        Canonicalizer sharded = new Canonicalizer(properties, executor);

        // Act
        CanonicalizationResult longParallel = sharded.canonicalize(longTable, null, longMapping);
        CanonicalizationResult wideParallel = sharded.canonicalize(wideTable, null, wideMapping);

        // Assert
        assertEquals(longSequential.getRows(), longParallel.getRows());
        assertEquals(longSequential.getDiagnostics().getCounts(), longParallel.getDiagnostics().getCounts());
        assertEquals(wideSequential.getRows(), wideParallel.getRows());
        assertEquals(63, wideParallel.getRows().size());
    }

    @Test
    @DisplayName("Should discard partial results and raise PipelineCancelledException when interrupted")
    void shouldStopWhenInterrupted() {
        RawTable table = generatedLongTable(10);
        MappingSpec mapping = MappingSpec.longFormat(Collections.singletonList("key"), "|", "date", "value");

        Thread.currentThread().interrupt();
        try {
            assertThrows(PipelineCancelledException.class, () -> canonicalizer.canonicalize(table, null, mapping));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Should reproduce an already canonical table under the identity mapping")
    void shouldBeIdempotentOnCanonicalInput() {
        // Arrange
        RawTable table = RawTable.builder()
                .column("cd_key", ColumnKind.TEXT, "A", "A", "B")
                .column("ds", ColumnKind.DATE, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1))
                .column("y", ColumnKind.FLOAT, 1.5, 2.0, -3.25)
                .build();
        MappingSpec mapping = MappingSpec.longFormat(Collections.singletonList("cd_key"), "|", "ds", "y");

        // Act
        CanonicalizationResult result = canonicalizer.canonicalize(table, null, mapping);

        // Assert
        assertEquals(new HashSet<>(Arrays.asList(
                new CanonicalRow("A", LocalDate.of(2024, 1, 1), 1.5),
                new CanonicalRow("A", LocalDate.of(2024, 2, 1), 2.0),
                new CanonicalRow("B", LocalDate.of(2024, 1, 1), -3.25))), new HashSet<>(result.getRows()));
    }

    private static RawTable generatedLongTable(int rows) {
        List<CellValue> keys = new ArrayList<>();
        List<CellValue> dates = new ArrayList<>();
        List<CellValue> values = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            keys.add(CellValue.text("k" + (i % 4)));
            dates.add(CellValue.date(LocalDate.of(2024, 1, 1).plusDays(i)));
            values.add(i % 11 == 0 ? CellValue.text("bad") : CellValue.number(i));
        }
        return new RawTable(Arrays.asList(
                new RawColumn("key", ColumnKind.TEXT, keys),
                new RawColumn("date", ColumnKind.DATE, dates),
                new RawColumn("value", ColumnKind.TEXT, values)));
    }

    private static RawTable generatedWideTable(int rows, int months) {
        List<RawColumn> columns = new ArrayList<>();
        List<CellValue> keys = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            keys.add(CellValue.text("store" + r));
        }
        columns.add(new RawColumn("key", ColumnKind.TEXT, keys));
        for (int m = 0; m < months; m++) {
            List<CellValue> cells = new ArrayList<>();
            for (int r = 0; r < rows; r++) {
                cells.add(CellValue.number(r * 100 + m));
            }
            columns.add(new RawColumn(String.format("2024-%02d", m + 1), ColumnKind.INTEGER, cells));
        }
        return new RawTable(columns);
    }
}
