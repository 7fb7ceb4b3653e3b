package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.exception.FileFormatException;
import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.ColumnKind;
import com.bmsedge.seriesprep.model.RawTable;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TableLoaderServiceTest {

    private TableLoaderService tableLoaderService;

    @BeforeEach
    void setUp() {
        tableLoaderService = new TableLoaderService();
    }

    private static InputStream utf8(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should read a CSV file with a byte order mark and blank lines")
    void shouldLoadCsv() {
        // Arrange
        String csv = "\uFEFFstore,date,sales\nA,2024-01-01,\"1,200.50\"\n\n,,\nB,2024-01-02,7\n";

        // Act
        RawTable table = tableLoaderService.load("sales.csv", utf8(csv));

        // Assert
        assertEquals(Arrays.asList("store", "date", "sales"), table.getColumnNames());
        assertEquals(2, table.getRowCount());
        assertEquals("1,200.50", table.getColumn("sales").get(0).asText());
        assertEquals(ColumnKind.FLOAT, table.getColumn("sales").getKind());
        assertEquals(ColumnKind.TEXT, table.getColumn("store").getKind());
    }

    @Test
    @DisplayName("Should split TSV files on tabs and pad short rows")
    void shouldLoadTsv() {
        RawTable table = tableLoaderService.load("SALES.TSV", utf8("sku\tqty\tnote\nx\t3\nY\t4\tlate\n"));

        assertEquals(3, table.getColumnCount());
        assertTrue(table.getColumn("note").get(0).isMissing());
        assertEquals("late", table.getColumn("note").get(1).asText());
        assertEquals(ColumnKind.INTEGER, table.getColumn("qty").getKind());
    }

    @Test
    @DisplayName("Should name blank headers by position and suffix repeated ones")
    void shouldNormalizeHeaderNames() {
        RawTable table = tableLoaderService.load("data.csv", utf8("store,,store,value\nA,1,2,3\n"));

        assertEquals(Arrays.asList("store", "column_2", "store_2", "value"), table.getColumnNames());
    }

    @Test
    @DisplayName("Should read the first sheet of a workbook, keeping date-formatted cells as dates")
    void shouldLoadExcelWorkbook() throws IOException {
        // Arrange
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
            Sheet sheet = workbook.createSheet("Sales");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Store");
            header.createCell(1).setCellValue(LocalDate.of(2024, 1, 1));
            header.getCell(1).setCellStyle(dateStyle);
            header.createCell(2).setCellValue("Feb-2024");
            Row data = sheet.createRow(2);
            data.createCell(0).setCellValue("A");
            data.createCell(1).setCellValue(10);
            data.createCell(2).setCellValue(12.5);
            workbook.createSheet("Ignored").createRow(0).createCell(0).setCellValue("other");
            workbook.write(out);
        }

        // Act
        MockMultipartFile file = new MockMultipartFile("file", "sales.xlsx",
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", out.toByteArray());
        RawTable table = tableLoaderService.load(file);

        // Assert
        assertEquals(Arrays.asList("Store", "2024-01-01", "Feb-2024"), table.getColumnNames());
        assertEquals(1, table.getRowCount());
        assertEquals(CellValue.Kind.NUMBER, table.getColumn("2024-01-01").get(0).getKind());
        assertEquals("10", table.getColumn("2024-01-01").get(0).asText());
        assertEquals(ColumnKind.FLOAT, table.getColumn("Feb-2024").getKind());
    }

    @Test
    @DisplayName("Should reject empty uploads, unknown extensions and files without a header")
    void shouldRejectUnreadableFiles() {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0]);

        assertThrows(FileFormatException.class, () -> tableLoaderService.load(empty));
        assertThrows(FileFormatException.class, () -> tableLoaderService.load("notes.txt", utf8("a,b\n1,2\n")));
        assertThrows(FileFormatException.class, () -> tableLoaderService.load("blank.csv", utf8("\n,,\n")));
    }

    @Test
    @DisplayName("Should report a corrupt workbook as a file format error")
    void shouldRejectCorruptWorkbook() {
        assertThrows(FileFormatException.class,
                () -> tableLoaderService.load("broken.xlsx", utf8("not really a workbook")));
    }
}
