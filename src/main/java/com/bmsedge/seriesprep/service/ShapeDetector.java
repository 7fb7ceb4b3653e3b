package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.config.PipelineProperties;
import com.bmsedge.seriesprep.model.ColumnProfile;
import com.bmsedge.seriesprep.model.RawTable;
import com.bmsedge.seriesprep.model.ShapeClassification;
import com.bmsedge.seriesprep.model.ShapeType;
import com.bmsedge.seriesprep.model.TableProfile;
import com.bmsedge.seriesprep.util.DateTokenParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides whether a table is WIDE (one column per date) or LONG (one row per date).
 *
 * <p>Two pieces of evidence are weighed: how many headers parse as date or period tokens, and how
 * well the best column's values parse as dates. Text columns are key candidates and never count
 * as date evidence. Detection never fails; weak evidence yields {@link ShapeType#AMBIGUOUS}.</p>
 */
@Component
public class ShapeDetector {

    private static final Logger logger = LoggerFactory.getLogger(ShapeDetector.class);

    // Ranking bonus for columns named like dates
    private static final double NAME_HINT_BONUS = 0.05;

    private final PipelineProperties properties;
    private final ColumnClassifier columnClassifier;

    public ShapeDetector(PipelineProperties properties, ColumnClassifier columnClassifier) {
        this.properties = properties;
        this.columnClassifier = columnClassifier;
    }

    public ShapeClassification detect(RawTable table) {
        return detect(table, columnClassifier.classify(table));
    }

    public ShapeClassification detect(RawTable table, TableProfile profile) {
        int totalColumns = table.getColumnCount();
        if (totalColumns == 0) {
            return new ShapeClassification(ShapeType.AMBIGUOUS, 0.0, 0.0, new ArrayList<>(), 0.0,
                    null, null, "table has no columns");
        }

        List<String> dateHeaders = new ArrayList<>();
        for (ColumnProfile column : profile.getColumns()) {
            if (!column.isText() && column.isHeaderDate()) {
                dateHeaders.add(column.getColumnName());
            }
        }
        double headerFraction = (double) dateHeaders.size() / totalColumns;

        List<String> candidates = rankDateCandidates(profile);
        String bestDateColumn = candidates.isEmpty() ? null : candidates.get(0);
        double valueFraction = 0.0;
        for (ColumnProfile column : profile.getColumns()) {
            if (!column.isText()) {
                valueFraction = Math.max(valueFraction, column.getDateFraction());
            }
        }

        boolean wideHolds = headerFraction >= properties.getWideHeaderThreshold()
                && dateHeaders.size() >= properties.getMinWideHeaders();
        boolean longHolds = valueFraction >= properties.getLongValueThreshold();

        ShapeType shape;
        double confidence;
        String notes;
        if (wideHolds && longHolds) {
            if (headerFraction > valueFraction) {
                shape = ShapeType.WIDE;
                confidence = headerFraction;
            } else {
                shape = ShapeType.LONG;
                confidence = valueFraction;
            }
            notes = String.format("both layouts plausible (headers %.2f, values %.2f); chose %s",
                    headerFraction, valueFraction, shape);
        } else if (wideHolds) {
            shape = ShapeType.WIDE;
            confidence = headerFraction;
            notes = String.format("%d of %d headers are dates", dateHeaders.size(), totalColumns);
        } else if (longHolds) {
            shape = ShapeType.LONG;
            confidence = valueFraction;
            notes = String.format("column '%s' holds dates (%.2f)", bestDateColumn, valueFraction);
        } else {
            shape = ShapeType.AMBIGUOUS;
            confidence = Math.max(headerFraction, valueFraction);
            notes = "neither date headers nor a date column found";
        }

        ShapeType suggested = null;
        if (shape != ShapeType.AMBIGUOUS && confidence < properties.getConfidenceFloor()) {
            suggested = shape;
            shape = ShapeType.AMBIGUOUS;
            notes = notes + String.format("; confidence %.2f below floor %.2f",
                    confidence, properties.getConfidenceFloor());
        }

        ShapeClassification classification = new ShapeClassification(shape, confidence, headerFraction,
                dateHeaders, valueFraction, bestDateColumn, suggested, notes);
        logger.info("Shape detected: {}", classification);
        return classification;
    }

    /**
     * Non-text columns holding at least one date value, best first. Columns named like dates
     * get a small bonus, so "order_date" outranks an equally dated "ref".
     */
    public List<String> rankDateCandidates(TableProfile profile) {
        List<ColumnProfile> candidates = new ArrayList<>();
        for (ColumnProfile column : profile.getColumns()) {
            if (!column.isText() && column.getDateFraction() > 0.0) {
                candidates.add(column);
            }
        }
        candidates.sort(Comparator.comparingDouble(ShapeDetector::candidateScore).reversed()
                .thenComparingInt(ColumnProfile::getColumnIndex));
        List<String> names = new ArrayList<>();
        for (ColumnProfile column : candidates) {
            names.add(column.getColumnName());
        }
        return names;
    }

    private static double candidateScore(ColumnProfile column) {
        double bonus = DateTokenParser.hasDateLikeName(column.getColumnName()) ? NAME_HINT_BONUS : 0.0;
        return column.getDateFraction() + bonus;
    }
}
