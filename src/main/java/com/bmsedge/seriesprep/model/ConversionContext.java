package com.bmsedge.seriesprep.model;

import lombok.Getter;

/**
 * State of one pipeline run. Each stage returns a new context instead of mutating this one.
 */
@Getter
public final class ConversionContext {

    private final RawTable table;
    private final TableProfile tableProfile;
    private final MappingOverride override;
    private final ShapeClassification classification;
    private final MappingSpec mapping;
    private final FrequencyLabel frequency;

    private ConversionContext(RawTable table, TableProfile tableProfile, MappingOverride override,
                              ShapeClassification classification, MappingSpec mapping, FrequencyLabel frequency) {
        this.table = table;
        this.tableProfile = tableProfile;
        this.override = override != null ? override : MappingOverride.none();
        this.classification = classification;
        this.mapping = mapping;
        this.frequency = frequency;
    }

    public static ConversionContext start(RawTable table, TableProfile tableProfile, MappingOverride override) {
        return new ConversionContext(table, tableProfile, override, null, null, null);
    }

    public ConversionContext withClassification(ShapeClassification classification) {
        return new ConversionContext(table, tableProfile, override, classification, mapping, frequency);
    }

    public ConversionContext withMapping(MappingSpec mapping) {
        return new ConversionContext(table, tableProfile, override, classification, mapping, frequency);
    }

    public ConversionContext withFrequency(FrequencyLabel frequency) {
        return new ConversionContext(table, tableProfile, override, classification, mapping, frequency);
    }
}
