package com.bmsedge.seriesprep.util;

import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.DiagnosticReason;
import com.bmsedge.seriesprep.model.ParseResult;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Locale-agnostic numeric parsing for observation cells.
 *
 * Currency symbols and grouping separators are stripped only when the reading is unambiguous.
 * A lone comma followed by exactly three digits ("1,234") could be either a decimal or a
 * thousands separator and is rejected.
 */
public class NumericValueParser {

    private static final String CURRENCY_SYMBOLS = "$€£¥₹₩₽¢";
    private static final Pattern CURRENCY_PREFIX = Pattern.compile("^(?:R|US|A|C|NZ|HK|S)\\$");
    private static final Pattern SCIENTIFIC = Pattern.compile("^(\\d+\\.?\\d*|\\.\\d+)[eE][+-]?\\d+$");
    private static final Pattern BODY = Pattern.compile("^[0-9.,' _]+$");
    private static final String SPACE_GROUPING = " '_";

    private static final Set<String> NULL_TOKENS = new HashSet<>(Arrays.asList(
            "na", "n/a", "null", "none", "-", "--", "\u2014", "#n/a"));
    private static final Set<String> NON_FINITE_TOKENS = new HashSet<>(Arrays.asList(
            "nan", "inf", "+inf", "-inf", "infinity", "+infinity", "-infinity", "∞", "-∞"));

    private NumericValueParser() {
    }

    public static ParseResult<Double> parse(CellValue cell) {
        switch (cell.getKind()) {
            case MISSING:
                return ParseResult.failure(DiagnosticReason.NULL_VALUE, "missing value");
            case NUMBER:
                double number = toDouble((Number) cell.getValue());
                if (!Double.isFinite(number)) {
                    return ParseResult.failure(DiagnosticReason.NON_FINITE_VALUE, String.valueOf(number));
                }
                return ParseResult.success(number);
            case TEXT:
                return parseText((String) cell.getValue());
            default:
                return ParseResult.failure(DiagnosticReason.NON_NUMERIC_VALUE,
                        cell.getKind().name().toLowerCase(Locale.ROOT) + " is not numeric: " + cell.asText());
        }
    }

    public static ParseResult<Double> parseText(String raw) {
        if (raw == null) {
            return ParseResult.failure(DiagnosticReason.NULL_VALUE, "missing value");
        }
        String s = raw.replace('\u00A0', ' ').replace('\u202F', ' ').trim();
        String lower = s.toLowerCase(Locale.ROOT);
        if (s.isEmpty() || NULL_TOKENS.contains(lower)) {
            return ParseResult.failure(DiagnosticReason.NULL_VALUE, "missing value: '" + raw + "'");
        }
        if (NON_FINITE_TOKENS.contains(lower)) {
            return ParseResult.failure(DiagnosticReason.NON_FINITE_VALUE, raw);
        }
        if (s.endsWith("%")) {
            return nonNumeric(raw, "percentages are not converted");
        }

        boolean negative = false;
        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1).trim();
        }

        boolean signSeen = false;
        boolean currencySeen = false;
        boolean changed = true;
        while (changed && !s.isEmpty()) {
            changed = false;
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if (first == '-' || first == '+') {
                if (signSeen) {
                    return nonNumeric(raw, "repeated sign");
                }
                signSeen = true;
                negative ^= first == '-';
                s = s.substring(1).trim();
                changed = true;
            } else if (CURRENCY_SYMBOLS.indexOf(first) >= 0 || CURRENCY_PREFIX.matcher(s).find()) {
                if (currencySeen) {
                    return nonNumeric(raw, "repeated currency symbol");
                }
                currencySeen = true;
                s = CURRENCY_SYMBOLS.indexOf(first) >= 0 ? s.substring(1).trim()
                        : CURRENCY_PREFIX.matcher(s).replaceFirst("").trim();
                changed = true;
            } else if (CURRENCY_SYMBOLS.indexOf(last) >= 0) {
                if (currencySeen) {
                    return nonNumeric(raw, "repeated currency symbol");
                }
                currencySeen = true;
                s = s.substring(0, s.length() - 1).trim();
                changed = true;
            }
        }
        if (s.isEmpty()) {
            return nonNumeric(raw, "no digits");
        }

        if (SCIENTIFIC.matcher(s).matches()) {
            return finite(raw, (negative ? "-" : "") + s);
        }
        if (!BODY.matcher(s).matches()) {
            return nonNumeric(raw, "unexpected characters");
        }
        String normalized = normalizeSeparators(s);
        if (normalized == null) {
            return nonNumeric(raw, "ambiguous or malformed digit grouping");
        }
        return finite(raw, (negative ? "-" : "") + normalized);
    }

    /**
     * Returns plain digits with an optional '.' decimal point, or null when the separators
     * cannot be read unambiguously.
     */
    private static String normalizeSeparators(String body) {
        int dots = count(body, '.');
        int commas = count(body, ',');
        char spaceGroup = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (SPACE_GROUPING.indexOf(c) >= 0) {
                if (spaceGroup != 0 && spaceGroup != c) {
                    return null;
                }
                spaceGroup = c;
            }
        }

        char decimal = 0;
        char grouping = spaceGroup;
        if (dots > 0 && commas > 0) {
            decimal = body.lastIndexOf('.') > body.lastIndexOf(',') ? '.' : ',';
            char other = decimal == '.' ? ',' : '.';
            if (grouping != 0) {
                return null;
            }
            grouping = other;
        } else if (commas == 1) {
            String before = body.substring(0, body.indexOf(','));
            String after = body.substring(body.indexOf(',') + 1);
            boolean looksGrouped = after.length() == 3 && isDigits(after)
                    && before.length() >= 1 && before.length() <= 3 && !before.startsWith("0");
            if (looksGrouped && spaceGroup == 0) {
                return null;
            }
            decimal = ',';
        } else if (commas > 1) {
            if (grouping != 0) {
                return null;
            }
            grouping = ',';
        } else if (dots > 1) {
            if (grouping != 0) {
                return null;
            }
            grouping = '.';
        } else if (dots == 1) {
            decimal = '.';
        }

        String integerPart = body;
        String fraction = "";
        if (decimal != 0) {
            int at = body.lastIndexOf(decimal);
            if (count(body, decimal) != 1) {
                return null;
            }
            integerPart = body.substring(0, at);
            fraction = body.substring(at + 1);
            if (!fraction.isEmpty() && !isDigits(fraction)) {
                return null;
            }
        }
        if (integerPart.isEmpty() && fraction.isEmpty()) {
            return null;
        }

        String digits = integerPart;
        if (grouping != 0 && integerPart.indexOf(grouping) >= 0) {
            String[] groups = integerPart.split(Pattern.quote(String.valueOf(grouping)), -1);
            if (groups[0].isEmpty() || groups[0].length() > 3 || !isDigits(groups[0])) {
                return null;
            }
            for (int i = 1; i < groups.length; i++) {
                if (groups[i].length() != 3 || !isDigits(groups[i])) {
                    return null;
                }
            }
            digits = String.join("", groups);
        } else if (!integerPart.isEmpty() && !isDigits(integerPart)) {
            return null;
        }

        if (digits.isEmpty()) {
            digits = "0";
        }
        return fraction.isEmpty() ? digits : digits + "." + fraction;
    }

    private static ParseResult<Double> finite(String raw, String canonical) {
        double value;
        try {
            value = Double.parseDouble(canonical);
        } catch (NumberFormatException e) {
            return nonNumeric(raw, "not a number");
        }
        if (!Double.isFinite(value)) {
            return ParseResult.failure(DiagnosticReason.NON_FINITE_VALUE, raw);
        }
        return ParseResult.success(value);
    }

    private static ParseResult<Double> nonNumeric(String raw, String why) {
        return ParseResult.failure(DiagnosticReason.NON_NUMERIC_VALUE, "'" + raw + "': " + why);
    }

    private static double toDouble(Number number) {
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).doubleValue();
        }
        return number.doubleValue();
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
