package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.exception.FileFormatException;
import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.ColumnKind;
import com.bmsedge.seriesprep.model.RawColumn;
import com.bmsedge.seriesprep.model.RawTable;
import com.bmsedge.seriesprep.util.NumericValueParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns an uploaded CSV, TSV or Excel file into a {@link RawTable}. The first non-empty row is the
 * header; fully empty rows are skipped. Only the first sheet of a workbook is read.
 */
@Service
public class TableLoaderService {

    private static final Logger logger = LoggerFactory.getLogger(TableLoaderService.class);

    public RawTable load(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || file.isEmpty()) {
            throw new FileFormatException("File cannot be empty");
        }
        try (InputStream in = file.getInputStream()) {
            return load(fileName, in);
        } catch (IOException e) {
            throw new FileFormatException("Error reading file: " + e.getMessage(), e);
        }
    }

    public RawTable load(String fileName, InputStream in) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        List<List<CellValue>> rows;
        if (lower.endsWith(".csv")) {
            rows = readDelimited(in, ',');
        } else if (lower.endsWith(".tsv")) {
            rows = readDelimited(in, '\t');
        } else if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
            rows = readWorkbook(in);
        } else {
            throw new FileFormatException(
                    "Unsupported file format. Please upload CSV (.csv, .tsv) or Excel (.xlsx, .xls) files only.");
        }
        RawTable table = toTable(rows);
        logger.info("Loaded '{}': {} rows x {} columns", fileName, table.getRowCount(), table.getColumnCount());
        return table;
    }

    private List<List<CellValue>> readDelimited(InputStream in, char separator) {
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        try (CSVReader csv = new CSVReaderBuilder(reader)
                .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
                .build()) {
            List<List<CellValue>> rows = new ArrayList<>();
            boolean first = true;
            for (String[] line : csv.readAll()) {
                List<CellValue> cells = new ArrayList<>(line.length);
                for (String value : line) {
                    if (first && cells.isEmpty() && value.startsWith("\uFEFF")) {
                        value = value.substring(1);
                    }
                    cells.add(CellValue.text(value));
                }
                first = false;
                rows.add(cells);
            }
            return rows;
        } catch (IOException | CsvException e) {
            throw new FileFormatException("Error parsing CSV file: " + e.getMessage(), e);
        }
    }

    private List<List<CellValue>> readWorkbook(InputStream in) {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new FileFormatException("Workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            List<List<CellValue>> rows = new ArrayList<>();
            for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                List<CellValue> cells = new ArrayList<>();
                if (row != null) {
                    for (int c = 0; c < Math.max(0, row.getLastCellNum()); c++) {
                        cells.add(toCellValue(row.getCell(c)));
                    }
                }
                rows.add(cells);
            }
            logger.debug("Read sheet '{}' with {} physical rows", sheet.getSheetName(), rows.size());
            return rows;
        } catch (IOException e) {
            throw new FileFormatException("Error parsing Excel file: " + e.getMessage(), e);
        }
    }

    private CellValue toCellValue(Cell cell) {
        if (cell == null) {
            return CellValue.missing();
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                return CellValue.text(cell.getStringCellValue());
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return CellValue.date(cell.getLocalDateTimeCellValue().toLocalDate());
                }
                return CellValue.number(cell.getNumericCellValue());
            case BOOLEAN:
                return CellValue.bool(cell.getBooleanCellValue());
            default:
                return CellValue.missing();
        }
    }

    private RawTable toTable(List<List<CellValue>> rows) {
        int headerIndex = 0;
        while (headerIndex < rows.size() && isRowEmpty(rows.get(headerIndex))) {
            headerIndex++;
        }
        if (headerIndex == rows.size()) {
            throw new FileFormatException("File has no header row");
        }

        List<List<CellValue>> dataRows = new ArrayList<>();
        int width = rows.get(headerIndex).size();
        for (int r = headerIndex + 1; r < rows.size(); r++) {
            List<CellValue> row = rows.get(r);
            if (!isRowEmpty(row)) {
                dataRows.add(row);
                width = Math.max(width, lastPresentIndex(row) + 1);
            }
        }

        List<String> names = headerNames(rows.get(headerIndex), width);
        List<RawColumn> columns = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            List<CellValue> values = new ArrayList<>(dataRows.size());
            for (List<CellValue> row : dataRows) {
                values.add(c < row.size() ? row.get(c) : CellValue.missing());
            }
            columns.add(new RawColumn(names.get(c), inferKind(values), values));
        }
        return new RawTable(columns);
    }

    /**
     * Blank headers become {@code column_N}; repeated names get a {@code _2}, {@code _3} suffix.
     */
    static List<String> headerNames(List<CellValue> header, int width) {
        List<String> names = new ArrayList<>(width);
        Set<String> used = new HashSet<>();
        for (int c = 0; c < width; c++) {
            CellValue cell = c < header.size() ? header.get(c) : CellValue.missing();
            String base = cell.isMissing() ? "column_" + (c + 1) : cell.asText();
            String name = base;
            int suffix = 2;
            while (!used.add(name)) {
                name = base + "_" + suffix++;
            }
            names.add(name);
        }
        return names;
    }

    // Loader kinds are hints only; the pipeline re-parses every cell
    private static ColumnKind inferKind(List<CellValue> values) {
        boolean anyPresent = false;
        boolean allDates = true;
        boolean allBooleans = true;
        boolean allNumeric = true;
        boolean allIntegral = true;
        for (CellValue value : values) {
            if (value.isMissing()) {
                continue;
            }
            anyPresent = true;
            allDates &= value.getKind() == CellValue.Kind.DATE;
            allBooleans &= value.getKind() == CellValue.Kind.BOOLEAN;
            Double number = NumericValueParser.parse(value).getValue();
            if (number == null) {
                allNumeric = false;
            } else if (number != Math.rint(number)) {
                allIntegral = false;
            }
        }
        if (!anyPresent) {
            return ColumnKind.UNKNOWN;
        }
        if (allDates) {
            return ColumnKind.DATE;
        }
        if (allBooleans) {
            return ColumnKind.BOOLEAN;
        }
        if (allNumeric) {
            return allIntegral ? ColumnKind.INTEGER : ColumnKind.FLOAT;
        }
        return ColumnKind.TEXT;
    }

    private static boolean isRowEmpty(List<CellValue> row) {
        return lastPresentIndex(row) < 0;
    }

    private static int lastPresentIndex(List<CellValue> row) {
        for (int c = row.size() - 1; c >= 0; c--) {
            if (row.get(c).isPresent()) {
                return c;
            }
        }
        return -1;
    }
}
