package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
public final class ShapeClassification {

    private final ShapeType shape;
    private final double confidence;

    // Evidence
    private final double headerDateFraction;
    private final int dateHeaderCount;
    private final List<String> dateHeaderColumns;
    private final double valueDateFraction;
    private final String bestDateColumn;
    private final ShapeType suggestedShape;
    private final String notes;

    public ShapeClassification(ShapeType shape, double confidence, double headerDateFraction,
                               List<String> dateHeaderColumns, double valueDateFraction,
                               String bestDateColumn, ShapeType suggestedShape, String notes) {
        this.shape = shape;
        this.confidence = confidence;
        this.headerDateFraction = headerDateFraction;
        this.dateHeaderColumns = Collections.unmodifiableList(new ArrayList<>(dateHeaderColumns));
        this.dateHeaderCount = dateHeaderColumns.size();
        this.valueDateFraction = valueDateFraction;
        this.bestDateColumn = bestDateColumn;
        this.suggestedShape = suggestedShape;
        this.notes = notes;
    }

    public boolean isAmbiguous() {
        return shape == ShapeType.AMBIGUOUS;
    }

    @Override
    public String toString() {
        return String.format("ShapeClassification[%s, confidence=%.2f, headers=%.2f (%d), values=%.2f (%s)]",
                shape, confidence, headerDateFraction, dateHeaderCount, valueDateFraction, bestDateColumn);
    }
}
