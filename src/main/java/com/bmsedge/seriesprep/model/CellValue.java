package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single table cell. Absence is the {@link Kind#MISSING} variant, never a null reference.
 */
@Getter
public final class CellValue {

    public enum Kind {
        MISSING,
        TEXT,
        NUMBER,
        DATE,
        BOOLEAN
    }

    private static final CellValue MISSING = new CellValue(Kind.MISSING, null);

    private final Kind kind;
    private final Object value;

    private CellValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static CellValue missing() {
        return MISSING;
    }

    public static CellValue text(String text) {
        if (text == null || text.trim().isEmpty()) {
            return MISSING;
        }
        return new CellValue(Kind.TEXT, text);
    }

    public static CellValue number(Number number) {
        if (number == null) {
            return MISSING;
        }
        return new CellValue(Kind.NUMBER, number);
    }

    public static CellValue date(LocalDate date) {
        if (date == null) {
            return MISSING;
        }
        return new CellValue(Kind.DATE, date);
    }

    public static CellValue bool(Boolean flag) {
        if (flag == null) {
            return MISSING;
        }
        return new CellValue(Kind.BOOLEAN, flag);
    }

    /**
     * Wraps a loosely typed value as produced by a loader or a test fixture.
     */
    public static CellValue of(Object raw) {
        if (raw == null) {
            return MISSING;
        }
        if (raw instanceof CellValue) {
            return (CellValue) raw;
        }
        if (raw instanceof LocalDateTime) {
            return date(((LocalDateTime) raw).toLocalDate());
        }
        if (raw instanceof LocalDate) {
            return date((LocalDate) raw);
        }
        if (raw instanceof Number) {
            return number((Number) raw);
        }
        if (raw instanceof Boolean) {
            return bool((Boolean) raw);
        }
        return text(raw.toString());
    }

    public boolean isMissing() {
        return kind == Kind.MISSING;
    }

    public boolean isPresent() {
        return kind != Kind.MISSING;
    }

    public String asText() {
        switch (kind) {
            case MISSING:
                return "";
            case TEXT:
                return ((String) value).trim();
            case NUMBER:
                return formatNumber((Number) value);
            default:
                return value.toString();
        }
    }

    private static String formatNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).stripTrailingZeros().toPlainString();
        }
        return number.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellValue)) return false;
        CellValue other = (CellValue) o;
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return isMissing() ? "<missing>" : asText();
    }
}
