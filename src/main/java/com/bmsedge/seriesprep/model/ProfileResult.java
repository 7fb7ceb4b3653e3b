package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the pipeline could infer about a table before converting it. When the mapping could not be
 * resolved, {@code mapping} is null and {@code missingRoles} says what must be declared.
 */
@Getter
public final class ProfileResult {

    private final ShapeClassification classification;
    private final List<ColumnProfile> columns;
    private final List<String> dateCandidates;
    private final FrequencyLabel frequency;
    private final MappingSpec mapping;
    private final List<String> missingRoles;
    private final List<String> notes;

    public ProfileResult(ShapeClassification classification, List<ColumnProfile> columns, List<String> dateCandidates,
                         FrequencyLabel frequency, MappingSpec mapping, List<String> missingRoles, List<String> notes) {
        this.classification = classification;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.dateCandidates = Collections.unmodifiableList(new ArrayList<>(dateCandidates));
        this.frequency = frequency;
        this.mapping = mapping;
        this.missingRoles = Collections.unmodifiableList(new ArrayList<>(missingRoles));
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
    }

    public boolean isMappingResolved() {
        return mapping != null;
    }
}
