package com.bmsedge.seriesprep.model;

/**
 * Primitive kind reported by the table loader. Treated as a hint only.
 */
public enum ColumnKind {
    TEXT,
    INTEGER,
    FLOAT,
    DATE,
    BOOLEAN,
    UNKNOWN
}
