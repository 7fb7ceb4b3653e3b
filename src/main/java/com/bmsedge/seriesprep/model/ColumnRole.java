package com.bmsedge.seriesprep.model;

public enum ColumnRole {
    DATE,
    NUMERIC,
    TEXT,
    UNKNOWN
}
