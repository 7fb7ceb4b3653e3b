package com.bmsedge.seriesprep.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated canonical series: unique (cd_key, ds), finite y, sorted by cd_key then ds.
 */
public final class CanonicalSeries {

    @Getter
    private final List<CanonicalRow> rows;

    private CanonicalSeries(List<CanonicalRow> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    public static CanonicalSeries empty() {
        return new CanonicalSeries(new ArrayList<>());
    }

    /**
     * @throws IllegalStateException when the rows break ordering, uniqueness or finiteness
     */
    public static CanonicalSeries fromValidatedRows(List<CanonicalRow> rows) {
        List<CanonicalRow> copy = new ArrayList<>(rows);
        CanonicalRow previous = null;
        for (CanonicalRow row : copy) {
            if (row.getCdKey() == null || row.getDs() == null || !Double.isFinite(row.getY())) {
                throw new IllegalStateException("Incomplete or non-finite row: " + row);
            }
            if (previous != null && CanonicalRow.KEY_DATE_ORDER.compare(previous, row) >= 0) {
                throw new IllegalStateException("Rows out of order or duplicated at " + row);
            }
            previous = row;
        }
        return new CanonicalSeries(copy);
    }

    public int size() {
        return rows.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        for (CanonicalRow row : rows) {
            keys.add(row.getCdKey());
        }
        return keys;
    }
}
