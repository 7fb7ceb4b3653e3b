package com.bmsedge.seriesprep.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Where dates or values come from: one column (long data) or a set of header columns (wide data).
 */
@Getter
public final class ColumnSource {

    public enum Kind {
        COLUMN,
        HEADERS
    }

    private final Kind kind;
    private final List<String> columns;

    private ColumnSource(Kind kind, List<String> columns) {
        this.kind = kind;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public static ColumnSource column(String name) {
        return new ColumnSource(Kind.COLUMN, Collections.singletonList(name));
    }

    public static ColumnSource headers(List<String> names) {
        return new ColumnSource(Kind.HEADERS, names);
    }

    @JsonIgnore
    public String getColumn() {
        if (kind != Kind.COLUMN) {
            throw new IllegalStateException("Header sources have no single column");
        }
        return columns.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnSource)) return false;
        ColumnSource that = (ColumnSource) o;
        return kind == that.kind && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, columns);
    }

    @Override
    public String toString() {
        return kind == Kind.COLUMN ? columns.get(0) : "headers" + columns;
    }
}
