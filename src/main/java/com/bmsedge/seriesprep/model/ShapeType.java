package com.bmsedge.seriesprep.model;

public enum ShapeType {
    /** One row per entity, one column per period. */
    WIDE,
    /** One row per entity and period, dates in a single column. */
    LONG,
    AMBIGUOUS
}
