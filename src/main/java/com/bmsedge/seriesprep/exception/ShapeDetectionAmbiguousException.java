package com.bmsedge.seriesprep.exception;

import com.bmsedge.seriesprep.model.ShapeClassification;
import lombok.Getter;

/**
 * The table layout could not be classified above the confidence floor and no override settles it.
 */
@Getter
public class ShapeDetectionAmbiguousException extends BusinessException {

    private final ShapeClassification classification;
    private final double confidenceFloor;

    public ShapeDetectionAmbiguousException(ShapeClassification classification, double confidenceFloor) {
        super(String.format(
                "Could not tell whether the table is wide or long (confidence %.2f, required %.2f). "
                        + "Declare the shape, the date column or the date header columns.",
                classification.getConfidence(), confidenceFloor));
        this.classification = classification;
        this.confidenceFloor = confidenceFloor;
    }
}
