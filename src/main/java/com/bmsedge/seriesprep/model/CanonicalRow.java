package com.bmsedge.seriesprep.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * One observation of the canonical (cd_key, ds, y) schema.
 */
@Getter
public final class CanonicalRow {

    public static final Comparator<CanonicalRow> KEY_DATE_ORDER =
            Comparator.comparing(CanonicalRow::getCdKey).thenComparing(CanonicalRow::getDs);

    @JsonProperty("cd_key")
    private final String cdKey;

    @JsonProperty("ds")
    private final LocalDate ds;

    @JsonProperty("y")
    private final double y;

    public CanonicalRow(String cdKey, LocalDate ds, double y) {
        this.cdKey = cdKey;
        this.ds = ds;
        this.y = y;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalRow)) return false;
        CanonicalRow that = (CanonicalRow) o;
        return Double.compare(that.y, y) == 0 && Objects.equals(cdKey, that.cdKey) && Objects.equals(ds, that.ds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cdKey, ds, y);
    }

    @Override
    public String toString() {
        return "(" + cdKey + "," + ds + "," + y + ")";
    }
}
