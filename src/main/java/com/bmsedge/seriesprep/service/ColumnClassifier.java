package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.config.PipelineProperties;
import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.ColumnProfile;
import com.bmsedge.seriesprep.model.ColumnRole;
import com.bmsedge.seriesprep.model.DiagnosticReason;
import com.bmsedge.seriesprep.model.ParseResult;
import com.bmsedge.seriesprep.model.RawColumn;
import com.bmsedge.seriesprep.model.RawTable;
import com.bmsedge.seriesprep.model.TableProfile;
import com.bmsedge.seriesprep.util.DateTokenParser;
import com.bmsedge.seriesprep.util.NumericValueParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Assigns each column a role from a sample of its non-missing values. Null placeholders are
 * skipped like empty cells, so a column holding only placeholders is {@link ColumnRole#UNKNOWN}. Runs once per table;
 * later stages read the cached {@link TableProfile}.
 */
@Component
public class ColumnClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ColumnClassifier.class);

    private static final double ROLE_THRESHOLD = 0.5;

    private final PipelineProperties properties;

    public ColumnClassifier(PipelineProperties properties) {
        this.properties = properties;
    }

    public TableProfile classify(RawTable table) {
        DateTokenParser dates = new DateTokenParser(properties.isDayFirst());
        List<ColumnProfile> profiles = new ArrayList<>();
        int index = 0;
        for (RawColumn column : table.getColumns()) {
            ColumnProfile profile = profileColumn(column, index++, dates);
            logger.debug("Column '{}' -> {} (date={}, numeric={}, sampled={})",
                    profile.getColumnName(), profile.getRole(),
                    String.format("%.2f", profile.getDateFraction()),
                    String.format("%.2f", profile.getNumericFraction()),
                    profile.getSampledValues());
            profiles.add(profile);
        }
        return new TableProfile(profiles);
    }

    private ColumnProfile profileColumn(RawColumn column, int index, DateTokenParser dates) {
        int limit = Math.max(1, properties.getProfileSampleLimit());
        int sampled = 0;
        int dateHits = 0;
        int numericHits = 0;
        for (CellValue cell : column.getValues()) {
            if (cell.isMissing()) {
                continue;
            }
            ParseResult<Double> number = NumericValueParser.parse(cell);
            // Placeholders such as "N/A" or "-" carry no type evidence
            if (number.getFailureReason() == DiagnosticReason.NULL_VALUE) {
                continue;
            }
            if (sampled >= limit) {
                break;
            }
            sampled++;
            if (dates.parseValue(cell).isSuccess()) {
                dateHits++;
            }
            if (number.isSuccess()) {
                numericHits++;
            }
        }

        LocalDate headerDate = dates.parseHeader(column.getName()).getValue();
        if (sampled == 0) {
            return new ColumnProfile(column.getName(), index, ColumnRole.UNKNOWN, 0.0, 0.0, 0.0, 0, headerDate);
        }

        double dateFraction = (double) dateHits / sampled;
        double numericFraction = (double) numericHits / sampled;
        ColumnRole role;
        double confidence;
        if (dateFraction >= ROLE_THRESHOLD && dateFraction >= numericFraction) {
            role = ColumnRole.DATE;
            confidence = dateFraction;
        } else if (numericFraction >= ROLE_THRESHOLD) {
            role = ColumnRole.NUMERIC;
            confidence = numericFraction;
        } else {
            role = ColumnRole.TEXT;
            confidence = 1.0 - Math.max(dateFraction, numericFraction);
        }
        return new ColumnProfile(column.getName(), index, role, confidence,
                dateFraction, numericFraction, sampled, headerDate);
    }
}
