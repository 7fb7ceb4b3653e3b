package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.time.Period;

/**
 * Sampling cadence. The alias is the cadence code handed to the forecaster.
 */
@Getter
public enum TimeFrequency {
    DAILY("D", Period.ofDays(1)),
    WEEKLY("W", Period.ofWeeks(1)),
    MONTHLY("MS", Period.ofMonths(1)),
    QUARTERLY("QS", Period.ofMonths(3)),
    YEARLY("YS", Period.ofYears(1)),
    IRREGULAR(null, null);

    private final String forecastAlias;
    private final Period interval;

    TimeFrequency(String forecastAlias, Period interval) {
        this.forecastAlias = forecastAlias;
        this.interval = interval;
    }
}
