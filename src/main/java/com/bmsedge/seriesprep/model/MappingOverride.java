package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partial mapping declared by the user. Every role that is set here wins over detection.
 */
@Getter
public final class MappingOverride {

    private static final MappingOverride NONE = new MappingOverride(null, null, null, null, null, null);

    private final ShapeType shape;
    private final List<String> keyColumns;
    private final String keySeparator;
    private final String dateColumn;
    private final String valueColumn;
    private final List<String> dateHeaderColumns;

    public MappingOverride(ShapeType shape, List<String> keyColumns, String keySeparator,
                           String dateColumn, String valueColumn, List<String> dateHeaderColumns) {
        this.shape = shape == ShapeType.AMBIGUOUS ? null : shape;
        this.keyColumns = keyColumns == null ? null : Collections.unmodifiableList(new ArrayList<>(keyColumns));
        this.keySeparator = keySeparator;
        this.dateColumn = blankToNull(dateColumn);
        this.valueColumn = blankToNull(valueColumn);
        this.dateHeaderColumns = dateHeaderColumns == null ? null
                : Collections.unmodifiableList(new ArrayList<>(dateHeaderColumns));
    }

    public static MappingOverride none() {
        return NONE;
    }

    public boolean hasShape() {
        return shape != null;
    }

    public boolean hasKeyColumns() {
        return keyColumns != null;
    }

    public boolean hasDateColumn() {
        return dateColumn != null;
    }

    public boolean hasValueColumn() {
        return valueColumn != null;
    }

    public boolean hasDateHeaderColumns() {
        return dateHeaderColumns != null && !dateHeaderColumns.isEmpty();
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
