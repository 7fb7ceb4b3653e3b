package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolved column roles for one conversion run.
 */
@Getter
public final class MappingSpec {

    private final ShapeType shape;
    private final List<String> keyColumns;
    private final String keySeparator;
    private final ColumnSource dateSource;
    private final ColumnSource valueSource;

    private MappingSpec(ShapeType shape, List<String> keyColumns, String keySeparator,
                        ColumnSource dateSource, ColumnSource valueSource) {
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one key column is required");
        }
        this.shape = shape;
        this.keyColumns = Collections.unmodifiableList(new ArrayList<>(keyColumns));
        this.keySeparator = keySeparator;
        this.dateSource = dateSource;
        this.valueSource = valueSource;
    }

    public static MappingSpec longFormat(List<String> keyColumns, String keySeparator,
                                         String dateColumn, String valueColumn) {
        return new MappingSpec(ShapeType.LONG, keyColumns, keySeparator,
                ColumnSource.column(dateColumn), ColumnSource.column(valueColumn));
    }

    // Header columns carry both the date (in the header) and the value (in the cell)
    public static MappingSpec wideFormat(List<String> keyColumns, String keySeparator, List<String> headerColumns) {
        ColumnSource headers = ColumnSource.headers(headerColumns);
        return new MappingSpec(ShapeType.WIDE, keyColumns, keySeparator, headers, headers);
    }

    public boolean isWide() {
        return shape == ShapeType.WIDE;
    }

    @Override
    public String toString() {
        return String.format("MappingSpec[%s, keys=%s, date=%s, value=%s]", shape, keyColumns, dateSource, valueSource);
    }
}
