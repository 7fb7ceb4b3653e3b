package com.bmsedge.seriesprep.util;

import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.DiagnosticReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateTokenParserTest {

    private final DateTokenParser dayFirst = new DateTokenParser(true);
    private final DateTokenParser monthFirst = new DateTokenParser(false);

    @Test
    @DisplayName("Should parse ISO dates with optional time suffix")
    void shouldParseIsoDates() {
        assertEquals(LocalDate.of(2024, 1, 8), dayFirst.parseValue(CellValue.text("2024-01-08")).getValue());
        assertEquals(LocalDate.of(2024, 1, 8), dayFirst.parseValue(CellValue.text("2024/1/8")).getValue());
        assertEquals(LocalDate.of(2024, 1, 8),
                dayFirst.parseValue(CellValue.text("2024-01-08T13:45:00Z")).getValue());
    }

    @Test
    @DisplayName("Should resolve slash dates by the unambiguous part, else by the configured order")
    void shouldResolveDayMonthOrder() {
        assertEquals(LocalDate.of(2024, 1, 31), dayFirst.parseValue(CellValue.text("31/01/2024")).getValue());
        assertEquals(LocalDate.of(2024, 1, 31), monthFirst.parseValue(CellValue.text("01/31/2024")).getValue());
        assertEquals(LocalDate.of(2024, 3, 2), dayFirst.parseValue(CellValue.text("02/03/2024")).getValue());
        assertEquals(LocalDate.of(2024, 2, 3), monthFirst.parseValue(CellValue.text("02/03/2024")).getValue());
        assertEquals(LocalDate.of(2024, 3, 2), dayFirst.parseValue(CellValue.text("02-03-24")).getValue());
    }

    @Test
    @DisplayName("Should map two-digit years to 2000-2069 and 1970-1999")
    void shouldMapTwoDigitYears() {
        assertEquals(LocalDate.of(2069, 5, 1), dayFirst.parseHeader("May-69").getValue());
        assertEquals(LocalDate.of(1970, 5, 1), dayFirst.parseHeader("May-70").getValue());
    }

    @Test
    @DisplayName("Should parse month names and period tokens to the first day of the period")
    void shouldParsePeriodTokens() {
        assertEquals(LocalDate.of(2024, 1, 1), dayFirst.parseHeader("Jan-2024").getValue());
        assertEquals(LocalDate.of(2024, 1, 1), dayFirst.parseHeader("January 2024").getValue());
        assertEquals(LocalDate.of(2024, 1, 1), dayFirst.parseHeader("2024-01").getValue());
        assertEquals(LocalDate.of(2024, 1, 1), dayFirst.parseHeader("01/2024").getValue());
        assertEquals(LocalDate.of(2024, 4, 1), dayFirst.parseHeader("2024-Q2").getValue());
        assertEquals(LocalDate.of(2024, 4, 1), dayFirst.parseHeader("Q2 2024").getValue());
        assertEquals(LocalDate.of(2024, 1, 29), dayFirst.parseHeader("2024-W05").getValue());
        assertEquals(LocalDate.of(2024, 1, 1), dayFirst.parseHeader("FY2024").getValue());
        assertEquals(LocalDate.of(2024, 3, 1), dayFirst.parseHeader("FY2024-P03").getValue());
        assertEquals(LocalDate.of(2024, 1, 15), dayFirst.parseHeader("15 Jan 2024").getValue());
        assertEquals(LocalDate.of(2024, 1, 15), dayFirst.parseHeader("Jan 15, 2024").getValue());
        assertEquals(LocalDate.of(2024, 2, 1), dayFirst.parseHeader("fev/2024").getValue());
    }

    @Test
    @DisplayName("Should accept a bare year as a header but not as a value")
    void shouldAcceptBareYearOnlyInHeaders() {
        assertEquals(LocalDate.of(2023, 1, 1), dayFirst.parseHeader("2023").getValue());
        assertTrue(dayFirst.parseValue(CellValue.text("2023")).isFailure());
        assertTrue(dayFirst.parseValue(CellValue.number(2023)).isFailure());
        assertFalse(dayFirst.isDateHeader("1850"));
    }

    @Test
    @DisplayName("Should read compact numbers as yyyyMMdd only when they form a valid date")
    void shouldParseCompactNumbers() {
        assertEquals(LocalDate.of(2024, 1, 8), dayFirst.parseValue(CellValue.number(20240108)).getValue());
        assertTrue(dayFirst.parseValue(CellValue.number(20241345)).isFailure());
        assertTrue(dayFirst.parseValue(CellValue.number(100)).isFailure());
    }

    @Test
    @DisplayName("Should not read float text or key labels as dates")
    void shouldRejectNonDates() {
        assertTrue(dayFirst.parseValue(CellValue.text("2024.5")).isFailure());
        assertTrue(dayFirst.parseValue(CellValue.text("Store A")).isFailure());
        assertTrue(dayFirst.parseValue(CellValue.text("31/02/2024")).isFailure());
        assertFalse(dayFirst.isDateHeader("Store"));
        assertFalse(dayFirst.isDateHeader("sales"));
    }

    @Test
    @DisplayName("Should report missing and unparseable dates with distinct reasons")
    void shouldReportFailureReasons() {
        assertEquals(DiagnosticReason.NULL_VALUE, dayFirst.parseValue(CellValue.missing()).getFailureReason());
        assertEquals(DiagnosticReason.UNPARSEABLE_DATE,
                dayFirst.parseValue(CellValue.text("not a date")).getFailureReason());
        assertEquals(DiagnosticReason.UNPARSEABLE_DATE,
                dayFirst.parseValue(CellValue.bool(true)).getFailureReason());
    }

    @Test
    @DisplayName("Should recognise date-like column names")
    void shouldRecogniseDateLikeNames() {
        assertTrue(DateTokenParser.hasDateLikeName("order_date"));
        assertTrue(DateTokenParser.hasDateLikeName("Month"));
        assertFalse(DateTokenParser.hasDateLikeName("store_id"));
    }
}
