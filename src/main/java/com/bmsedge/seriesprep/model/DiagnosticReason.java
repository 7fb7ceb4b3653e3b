package com.bmsedge.seriesprep.model;

public enum DiagnosticReason {
    DUPLICATE_KEY_DATE,
    UNPARSEABLE_DATE,
    UNPARSEABLE_HEADER,
    NON_NUMERIC_VALUE,
    NON_FINITE_VALUE,
    NULL_VALUE
}
