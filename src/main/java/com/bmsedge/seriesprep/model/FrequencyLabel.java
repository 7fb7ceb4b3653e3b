package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.time.Period;

@Getter
public final class FrequencyLabel {

    private final TimeFrequency frequency;
    private final double confidence;
    private final Period dominantInterval;
    private final Double medianDeltaDays;
    private final int pointCount;
    private final boolean inconclusive;
    private final String notes;

    public FrequencyLabel(TimeFrequency frequency, double confidence, Period dominantInterval,
                          Double medianDeltaDays, int pointCount, boolean inconclusive, String notes) {
        this.frequency = frequency;
        this.confidence = confidence;
        this.dominantInterval = dominantInterval;
        this.medianDeltaDays = medianDeltaDays;
        this.pointCount = pointCount;
        this.inconclusive = inconclusive;
        this.notes = notes;
    }

    public String getForecastAlias() {
        return frequency.getForecastAlias();
    }

    @Override
    public String toString() {
        return String.format("FrequencyLabel[%s, confidence=%.2f, interval=%s, points=%d]",
                frequency, confidence, dominantInterval, pointCount);
    }
}
