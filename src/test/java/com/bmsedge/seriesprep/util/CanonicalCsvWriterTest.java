package com.bmsedge.seriesprep.util;

import com.bmsedge.seriesprep.model.CanonicalRow;
import com.bmsedge.seriesprep.model.CanonicalSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.LocalDate;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalCsvWriterTest {

    @Test
    @DisplayName("Should write the cd_key,ds,y header with ISO dates and plain decimals")
    void shouldWriteCanonicalSchema() throws Exception {
        // Arrange
        CanonicalSeries series = CanonicalSeries.fromValidatedRows(Arrays.asList(
                new CanonicalRow("A", LocalDate.of(2024, 1, 1), 10.0),
                new CanonicalRow("A", LocalDate.of(2024, 2, 1), 0.00000015),
                new CanonicalRow("B", LocalDate.of(2024, 1, 1), -2.5)));
        StringWriter out = new StringWriter();

        // Act
        CanonicalCsvWriter.write(series, out);

        // Assert
        assertEquals("cd_key,ds,y\n"
                + "A,2024-01-01,10.0\n"
                + "A,2024-02-01,0.00000015\n"
                + "B,2024-01-01,-2.5\n", out.toString());
    }

    @Test
    @DisplayName("Should quote keys that contain the CSV separator")
    void shouldQuoteKeysWithSeparator() throws Exception {
        // Arrange
        CanonicalSeries series = CanonicalSeries.fromValidatedRows(Arrays.asList(
                new CanonicalRow("North, East|A", LocalDate.of(2024, 1, 1), 1.0)));
        StringWriter out = new StringWriter();

        // Act
        CanonicalCsvWriter.write(series, out);

        // Assert
        assertEquals("cd_key,ds,y\n\"North, East|A\",2024-01-01,1.0\n", out.toString());
    }

    @Test
    @DisplayName("Should write only the header for an empty series")
    void shouldWriteHeaderForEmptySeries() throws Exception {
        StringWriter out = new StringWriter();

        CanonicalCsvWriter.write(CanonicalSeries.empty(), out);

        assertEquals("cd_key,ds,y\n", out.toString());
    }
}
