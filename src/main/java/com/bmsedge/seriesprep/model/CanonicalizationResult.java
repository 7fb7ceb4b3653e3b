package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonicalizer output: rows in emission order, neither de-duplicated nor sorted.
 */
@Getter
public final class CanonicalizationResult {

    private final List<CanonicalRow> rows;
    private final Diagnostics diagnostics;

    public CanonicalizationResult(List<CanonicalRow> rows, Diagnostics diagnostics) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.diagnostics = diagnostics;
    }
}
