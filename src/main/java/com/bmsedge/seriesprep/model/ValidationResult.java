package com.bmsedge.seriesprep.model;

import lombok.Getter;

@Getter
public final class ValidationResult {

    private final CanonicalSeries series;
    private final Diagnostics diagnostics;

    public ValidationResult(CanonicalSeries series, Diagnostics diagnostics) {
        this.series = series;
        this.diagnostics = diagnostics;
    }
}
