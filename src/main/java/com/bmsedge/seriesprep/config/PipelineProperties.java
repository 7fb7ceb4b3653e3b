package com.bmsedge.seriesprep.config;

import com.bmsedge.seriesprep.model.DuplicatePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the profiling and canonicalization pipeline, bound from {@code seriesprep.pipeline.*}.
 */
@Setter
@Getter
@ConfigurationProperties(prefix = "seriesprep.pipeline")
public class PipelineProperties {

    // Shape detection
    private double confidenceFloor = 0.6;
    private double wideHeaderThreshold = 0.5;
    private int minWideHeaders = 2;
    private double longValueThreshold = 0.8;

    // Frequency inference
    private double frequencyShareThreshold = 0.7;
    private int gapMultiplierLimit = 6;
    private int minFrequencyPoints = 3;

    // Keys and parsing
    private String keySeparator = "|";
    private String nullKeyToken = "";
    private boolean dayFirst = true;

    private int profileSampleLimit = 500;
    private int diagnosticSampleLimit = 20;
    private DuplicatePolicy duplicatePolicy = DuplicatePolicy.REJECT;

    // Data-parallel canonicalization kicks in above this many cells
    private int parallelThreshold = 200_000;
    private int workerThreads = 4;
    private int shardSize = 5_000;
}
