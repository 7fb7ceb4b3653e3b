package com.bmsedge.seriesprep.model;

/**
 * How the validator treats several rows sharing one (cd_key, ds) pair. Only REJECT keeps
 * the data untouched; the aggregating policies are opt-in.
 */
public enum DuplicatePolicy {
    REJECT,
    SUM,
    MEAN,
    LAST_WINS
}
