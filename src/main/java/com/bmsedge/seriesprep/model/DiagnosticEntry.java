package com.bmsedge.seriesprep.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sampled record of one dropped cell, row, header or key-date pair.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DiagnosticEntry {

    private final DiagnosticReason reason;
    private final Integer rowIndex;
    private final String column;
    private final String cdKey;
    private final LocalDate ds;
    private final String rawValue;
    private final List<Double> conflictingValues;
    private final String message;

    private DiagnosticEntry(Builder builder) {
        this.reason = builder.reason;
        this.rowIndex = builder.rowIndex;
        this.column = builder.column;
        this.cdKey = builder.cdKey;
        this.ds = builder.ds;
        this.rawValue = builder.rawValue;
        this.conflictingValues = builder.conflictingValues == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.conflictingValues));
        this.message = builder.message;
    }

    public static Builder builder(DiagnosticReason reason) {
        return new Builder(reason);
    }

    public static class Builder {
        private final DiagnosticReason reason;
        private Integer rowIndex;
        private String column;
        private String cdKey;
        private LocalDate ds;
        private String rawValue;
        private List<Double> conflictingValues;
        private String message;

        private Builder(DiagnosticReason reason) {
            this.reason = reason;
        }

        public Builder rowIndex(Integer rowIndex) {
            this.rowIndex = rowIndex;
            return this;
        }

        public Builder column(String column) {
            this.column = column;
            return this;
        }

        public Builder cdKey(String cdKey) {
            this.cdKey = cdKey;
            return this;
        }

        public Builder ds(LocalDate ds) {
            this.ds = ds;
            return this;
        }

        public Builder rawValue(String rawValue) {
            this.rawValue = rawValue;
            return this;
        }

        public Builder conflictingValues(List<Double> conflictingValues) {
            this.conflictingValues = conflictingValues;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public DiagnosticEntry build() {
            return new DiagnosticEntry(this);
        }
    }
}
