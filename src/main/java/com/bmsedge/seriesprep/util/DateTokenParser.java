package com.bmsedge.seriesprep.util;

import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.DiagnosticReason;
import com.bmsedge.seriesprep.model.ParseResult;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses date cells and date-like headers into calendar dates.
 *
 * Period tokens resolve to the first day of their period: "Jan-2024" and "2024-01" to 2024-01-01,
 * "2024-Q2" to 2024-04-01, "2024-W05" to the Monday of ISO week 5, "FY2024-P03" to 2024-03-01.
 * Bare four-digit years are accepted for headers only, since a numeric value column full of
 * integers like 2000 must not read as dates.
 */
public class DateTokenParser {

    // Matched against lower-cased input
    private static final String TIME_SUFFIX =
            "(?:[t ]\\d{1,2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?(?:\\s*(?:z|[+-]\\d{2}:?\\d{2}))?)?";

    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})" + TIME_SUFFIX + "$");
    private static final Pattern DMY_DATE = Pattern.compile("^(\\d{1,2})([-/.])(\\d{1,2})\\2(\\d{4}|\\d{2})" + TIME_SUFFIX + "$");
    private static final Pattern COMPACT_DATE = Pattern.compile("^(\\d{4})(\\d{2})(\\d{2})$");
    private static final Pattern DAY_MONTH_NAME_YEAR = Pattern.compile("^(\\d{1,2})[\\s\\-/.]+([a-z]{3,9})\\.?[\\s\\-/.,]+(\\d{4}|\\d{2})$");
    private static final Pattern MONTH_NAME_DAY_YEAR = Pattern.compile("^([a-z]{3,9})\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})$");
    private static final Pattern ISO_WEEK = Pattern.compile("^(\\d{4})-?w(\\d{1,2})$");
    private static final Pattern YEAR_QUARTER = Pattern.compile("^(?:fy\\s*)?(\\d{4})\\s*[-/ ]?\\s*q([1-4])$");
    private static final Pattern QUARTER_YEAR = Pattern.compile("^q([1-4])\\s*[-/ ']?\\s*(?:fy\\s*)?(\\d{4}|\\d{2})$");
    private static final Pattern FISCAL_YEAR_PERIOD = Pattern.compile("^(?:fy\\s*(\\d{4}|\\d{2})|(\\d{4}))\\s*[-/ ]?\\s*p(\\d{1,2})$");
    private static final Pattern PERIOD_FISCAL_YEAR = Pattern.compile("^p(\\d{1,2})\\s*[-/ ]?\\s*(?:fy\\s*)?(\\d{4})$");
    private static final Pattern FISCAL_YEAR = Pattern.compile("^fy\\s*[-']?\\s*(\\d{4}|\\d{2})$");
    private static final Pattern MONTH_NAME_YEAR = Pattern.compile("^([a-z]{3,9})\\.?[\\s\\-/'_]*(\\d{4}|\\d{2})$");
    private static final Pattern YEAR_MONTH_NAME = Pattern.compile("^(\\d{4})[\\s\\-/]([a-z]{3,9})$");
    private static final Pattern YEAR_MONTH = Pattern.compile("^(\\d{4})[-/](\\d{1,2})$");
    private static final Pattern MONTH_YEAR = Pattern.compile("^(\\d{1,2})[-/](\\d{4})$");
    private static final Pattern BARE_YEAR = Pattern.compile("^(\\d{4})$");

    private static final Pattern DATE_NAME_HINT =
            Pattern.compile("(date|data|dt|day|dia|week|month|mes|year|ano|period|time|fecha)", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> MONTHS = new HashMap<>();

    static {
        String[] english = {"january", "february", "march", "april", "may", "june", "july",
                "august", "september", "october", "november", "december"};
        for (int i = 0; i < english.length; i++) {
            MONTHS.put(english[i], i + 1);
            MONTHS.put(english[i].substring(0, 3), i + 1);
        }
        MONTHS.put("sept", 9);
        // Portuguese and Spanish abbreviations
        MONTHS.put("fev", 2);
        MONTHS.put("abr", 4);
        MONTHS.put("mai", 5);
        MONTHS.put("ago", 8);
        MONTHS.put("set", 9);
        MONTHS.put("out", 10);
        MONTHS.put("dez", 12);
        MONTHS.put("ene", 1);
        MONTHS.put("dic", 12);
    }

    private final boolean dayFirst;

    public DateTokenParser(boolean dayFirst) {
        this.dayFirst = dayFirst;
    }

    /**
     * Parses a cell value. Date cells pass through; numbers only count when they spell a
     * compact yyyyMMdd date.
     */
    public ParseResult<LocalDate> parseValue(CellValue cell) {
        switch (cell.getKind()) {
            case MISSING:
                return ParseResult.failure(DiagnosticReason.NULL_VALUE, "missing date");
            case DATE:
                return ParseResult.success((LocalDate) cell.getValue());
            case NUMBER:
                LocalDate compact = compactNumber((Number) cell.getValue());
                if (compact != null) {
                    return ParseResult.success(compact);
                }
                return unparseable(cell.asText());
            case TEXT:
                return parseText((String) cell.getValue(), false);
            default:
                return unparseable(cell.asText());
        }
    }

    public ParseResult<LocalDate> parseHeader(String header) {
        return parseText(header, true);
    }

    public boolean isDateHeader(String header) {
        return parseHeader(header).isSuccess();
    }

    /**
     * True when a column name hints at dates ("order_date", "month", "ano").
     */
    public static boolean hasDateLikeName(String columnName) {
        return columnName != null && DATE_NAME_HINT.matcher(columnName).find();
    }

    private ParseResult<LocalDate> parseText(String raw, boolean header) {
        if (raw == null || raw.trim().isEmpty()) {
            return ParseResult.failure(DiagnosticReason.NULL_VALUE, "missing date");
        }
        String s = raw.trim().toLowerCase(Locale.ROOT);
        LocalDate date = match(s, header);
        if (date == null) {
            return unparseable(raw);
        }
        return ParseResult.success(date);
    }

    private LocalDate match(String s, boolean header) {
        Matcher m = ISO_DATE.matcher(s);
        if (m.matches()) {
            return safeDate(num(m, 1), num(m, 2), num(m, 3));
        }
        m = DMY_DATE.matcher(s);
        if (m.matches()) {
            return dayMonthYear(num(m, 1), num(m, 3), year(m.group(4)));
        }
        m = COMPACT_DATE.matcher(s);
        if (m.matches()) {
            int y = num(m, 1);
            return y >= 1900 && y <= 2100 ? safeDate(y, num(m, 2), num(m, 3)) : null;
        }
        m = DAY_MONTH_NAME_YEAR.matcher(s);
        if (m.matches() && MONTHS.containsKey(m.group(2))) {
            return safeDate(year(m.group(3)), MONTHS.get(m.group(2)), num(m, 1));
        }
        m = MONTH_NAME_DAY_YEAR.matcher(s);
        if (m.matches() && MONTHS.containsKey(m.group(1))) {
            return safeDate(num(m, 3), MONTHS.get(m.group(1)), num(m, 2));
        }
        m = ISO_WEEK.matcher(s);
        if (m.matches()) {
            return isoWeekStart(num(m, 1), num(m, 2));
        }
        m = YEAR_QUARTER.matcher(s);
        if (m.matches()) {
            return periodStart(num(m, 1), (num(m, 2) - 1) * 3 + 1, 1);
        }
        m = QUARTER_YEAR.matcher(s);
        if (m.matches()) {
            return periodStart(year(m.group(2)), (num(m, 1) - 1) * 3 + 1, 1);
        }
        m = FISCAL_YEAR_PERIOD.matcher(s);
        if (m.matches()) {
            int y = m.group(1) != null ? year(m.group(1)) : num(m, 2);
            return periodStart(y, num(m, 3), 1);
        }
        m = PERIOD_FISCAL_YEAR.matcher(s);
        if (m.matches()) {
            return periodStart(num(m, 2), num(m, 1), 1);
        }
        m = FISCAL_YEAR.matcher(s);
        if (m.matches()) {
            return periodStart(year(m.group(1)), 1, 1);
        }
        m = MONTH_NAME_YEAR.matcher(s);
        if (m.matches() && MONTHS.containsKey(m.group(1))) {
            return periodStart(year(m.group(2)), MONTHS.get(m.group(1)), 1);
        }
        m = YEAR_MONTH_NAME.matcher(s);
        if (m.matches() && MONTHS.containsKey(m.group(2))) {
            return periodStart(num(m, 1), MONTHS.get(m.group(2)), 1);
        }
        m = YEAR_MONTH.matcher(s);
        if (m.matches()) {
            return periodStart(num(m, 1), num(m, 2), 1);
        }
        m = MONTH_YEAR.matcher(s);
        if (m.matches()) {
            return periodStart(num(m, 2), num(m, 1), 1);
        }
        if (header) {
            m = BARE_YEAR.matcher(s);
            if (m.matches()) {
                int y = num(m, 1);
                return y >= 1900 && y <= 2100 ? LocalDate.of(y, 1, 1) : null;
            }
        }
        return null;
    }

    // Either part above 12 settles the order; otherwise the configured convention applies
    private LocalDate dayMonthYear(int first, int second, int year) {
        if (first > 12 && second > 12) {
            return null;
        }
        if (first > 12) {
            return safeDate(year, second, first);
        }
        if (second > 12) {
            return safeDate(year, first, second);
        }
        return dayFirst ? safeDate(year, second, first) : safeDate(year, first, second);
    }

    private static LocalDate compactNumber(Number number) {
        double d = number instanceof BigDecimal ? ((BigDecimal) number).doubleValue() : number.doubleValue();
        if (!Double.isFinite(d) || d != Math.rint(d) || d < 19000101 || d > 21001231) {
            return null;
        }
        long v = (long) d;
        return safeDate((int) (v / 10000), (int) (v / 100 % 100), (int) (v % 100));
    }

    private static LocalDate isoWeekStart(int year, int week) {
        if (year < 1900 || year > 2100 || week < 1) {
            return null;
        }
        LocalDate reference = LocalDate.of(year, 1, 4);
        long weeksInYear = reference.range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum();
        if (week > weeksInYear) {
            return null;
        }
        return reference.with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week).with(DayOfWeek.MONDAY);
    }

    // Partial tokens are only trusted for plausible calendar years
    private static LocalDate periodStart(int year, int month, int day) {
        if (year < 1900 || year > 2100) {
            return null;
        }
        return safeDate(year, month, day);
    }

    static LocalDate safeDate(int year, int month, int day) {
        if (year < 1000 || year > 9999 || month < 1 || month > 12 || day < 1) {
            return null;
        }
        if (day > YearMonth.of(year, month).lengthOfMonth()) {
            return null;
        }
        return LocalDate.of(year, month, day);
    }

    // Two-digit years: 00-69 are 2000s, 70-99 are 1900s
    private static int year(String digits) {
        int y = Integer.parseInt(digits);
        if (digits.length() == 2) {
            return y < 70 ? 2000 + y : 1900 + y;
        }
        return y;
    }

    private static int num(Matcher m, int group) {
        return Integer.parseInt(m.group(group));
    }

    private static ParseResult<LocalDate> unparseable(String raw) {
        return ParseResult.failure(DiagnosticReason.UNPARSEABLE_DATE, "'" + raw + "' is not a recognised date");
    }
}
