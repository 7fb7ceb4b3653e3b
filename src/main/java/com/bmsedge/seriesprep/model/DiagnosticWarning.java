package com.bmsedge.seriesprep.model;

import lombok.Getter;

@Getter
public final class DiagnosticWarning {

    public static final String FREQUENCY_INCONCLUSIVE = "FREQUENCY_INCONCLUSIVE";
    public static final String MAPPING_OVERRIDE = "MAPPING_OVERRIDE";

    private final String code;
    private final String message;

    public DiagnosticWarning(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
