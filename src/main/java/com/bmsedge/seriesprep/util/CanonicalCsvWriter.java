package com.bmsedge.seriesprep.util;

import com.bmsedge.seriesprep.model.CanonicalRow;
import com.bmsedge.seriesprep.model.CanonicalSeries;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;

/**
 * Writes the canonical interchange schema: exactly {@code cd_key,ds,y}, ISO dates, plain decimals.
 */
public class CanonicalCsvWriter {

    public static final String[] HEADER = {"cd_key", "ds", "y"};

    private CanonicalCsvWriter() {
    }

    public static void write(CanonicalSeries series, Writer out) throws IOException {
        CSVWriter writer = new CSVWriter(out,
                ICSVWriter.DEFAULT_SEPARATOR,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
                ICSVWriter.DEFAULT_LINE_END);
        writer.writeNext(HEADER, false);
        for (CanonicalRow row : series.getRows()) {
            writer.writeNext(new String[]{
                    row.getCdKey(),
                    row.getDs().toString(),
                    formatValue(row.getY())
            }, false);
        }
        writer.flush();
        if (writer.checkError()) {
            throw new IOException("Failed to write canonical CSV");
        }
    }

    static String formatValue(double y) {
        return BigDecimal.valueOf(y).toPlainString();
    }
}
