package com.bmsedge.seriesprep.model;

import lombok.Getter;

@Getter
public final class ConversionResult {

    private final CanonicalSeries series;
    private final Diagnostics diagnostics;
    private final ShapeClassification classification;
    private final MappingSpec mapping;
    private final FrequencyLabel frequency;
    private final int inputRows;

    public ConversionResult(CanonicalSeries series, Diagnostics diagnostics, ShapeClassification classification,
                            MappingSpec mapping, FrequencyLabel frequency, int inputRows) {
        this.series = series;
        this.diagnostics = diagnostics;
        this.classification = classification;
        this.mapping = mapping;
        this.frequency = frequency;
        this.inputRows = inputRows;
    }
}
