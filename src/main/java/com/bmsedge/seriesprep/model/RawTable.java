package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable in-memory table handed over by the loader. Every column has the same row count
 * and column names are unique.
 */
public final class RawTable {

    @Getter
    private final List<RawColumn> columns;

    @Getter
    private final int rowCount;

    private final Map<String, RawColumn> byName;

    public RawTable(List<RawColumn> columns) {
        Map<String, RawColumn> index = new LinkedHashMap<>();
        int rows = -1;
        for (RawColumn column : columns) {
            if (index.put(column.getName(), column) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
            if (rows >= 0 && column.size() != rows) {
                throw new IllegalArgumentException(String.format(
                        "Column '%s' has %d rows, expected %d", column.getName(), column.size(), rows));
            }
            rows = column.size();
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.byName = Collections.unmodifiableMap(index);
        this.rowCount = Math.max(rows, 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(byName.keySet());
    }

    public boolean hasColumn(String name) {
        return byName.containsKey(name);
    }

    public RawColumn getColumn(String name) {
        RawColumn column = byName.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return column;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public static class Builder {
        private final List<RawColumn> columns = new ArrayList<>();

        public Builder column(String name, ColumnKind kind, Object... values) {
            List<CellValue> cells = new ArrayList<>(values.length);
            for (Object value : values) {
                cells.add(CellValue.of(value));
            }
            columns.add(new RawColumn(name, kind, cells));
            return this;
        }

        public Builder column(RawColumn column) {
            columns.add(column);
            return this;
        }

        public RawTable build() {
            return new RawTable(columns);
        }
    }
}
