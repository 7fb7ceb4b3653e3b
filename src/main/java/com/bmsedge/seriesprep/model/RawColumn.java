package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
public final class RawColumn {

    private final String name;
    private final ColumnKind kind;
    private final List<CellValue> values;

    public RawColumn(String name, ColumnKind kind, List<CellValue> values) {
        if (name == null) {
            throw new IllegalArgumentException("Column name is required");
        }
        this.name = name;
        this.kind = kind != null ? kind : ColumnKind.UNKNOWN;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public CellValue get(int rowIndex) {
        return values.get(rowIndex);
    }

    public int size() {
        return values.size();
    }
}
