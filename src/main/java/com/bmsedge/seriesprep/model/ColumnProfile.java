package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.time.LocalDate;

/**
 * Cached classification of one column, computed once per pipeline run.
 */
@Getter
public final class ColumnProfile {

    private final String columnName;
    private final int columnIndex;
    private final ColumnRole role;
    private final double confidence;
    private final double dateFraction;
    private final double numericFraction;
    private final int sampledValues;

    // Header parsed as a date or period token, null when the header is not one
    private final LocalDate headerDate;

    public ColumnProfile(String columnName, int columnIndex, ColumnRole role, double confidence,
                         double dateFraction, double numericFraction, int sampledValues, LocalDate headerDate) {
        this.columnName = columnName;
        this.columnIndex = columnIndex;
        this.role = role;
        this.confidence = confidence;
        this.dateFraction = dateFraction;
        this.numericFraction = numericFraction;
        this.sampledValues = sampledValues;
        this.headerDate = headerDate;
    }

    public boolean isHeaderDate() {
        return headerDate != null;
    }

    public boolean isText() {
        return role == ColumnRole.TEXT;
    }
}
