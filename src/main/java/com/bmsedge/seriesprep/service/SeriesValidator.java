package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.config.PipelineProperties;
import com.bmsedge.seriesprep.model.CanonicalRow;
import com.bmsedge.seriesprep.model.CanonicalSeries;
import com.bmsedge.seriesprep.model.DiagnosticEntry;
import com.bmsedge.seriesprep.model.DiagnosticReason;
import com.bmsedge.seriesprep.model.DiagnosticsCollector;
import com.bmsedge.seriesprep.model.DuplicatePolicy;
import com.bmsedge.seriesprep.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Last stage of the pipeline and the only place a {@link CanonicalSeries} is built.
 *
 * <p>Every duplicate (cd_key, ds) pair is reported with all of its values whatever the policy.
 * {@link DuplicatePolicy#REJECT} drops the pair; the other policies fold it into one row.</p>
 */
@Component
public class SeriesValidator {

    private static final Logger logger = LoggerFactory.getLogger(SeriesValidator.class);

    private final PipelineProperties properties;

    public SeriesValidator(PipelineProperties properties) {
        this.properties = properties;
    }

    public ValidationResult validate(List<CanonicalRow> rows, DuplicatePolicy policy) {
        DuplicatePolicy effective = policy != null ? policy : properties.getDuplicatePolicy();
        DiagnosticsCollector diagnostics = new DiagnosticsCollector(properties.getDiagnosticSampleLimit());

        // cd_key then ds, natural order
        Map<String, Map<LocalDate, List<Double>>> grouped = new TreeMap<>();
        for (CanonicalRow row : rows) {
            if (row.getCdKey() == null || row.getDs() == null) {
                diagnostics.record(DiagnosticEntry.builder(DiagnosticReason.NULL_VALUE)
                        .cdKey(row.getCdKey())
                        .ds(row.getDs())
                        .message("row has no key or no date")
                        .build());
                continue;
            }
            if (!Double.isFinite(row.getY())) {
                diagnostics.record(nonFinite(row.getCdKey(), row.getDs(), row.getY()));
                continue;
            }
            grouped.computeIfAbsent(row.getCdKey(), k -> new TreeMap<>())
                    .computeIfAbsent(row.getDs(), d -> new ArrayList<>())
                    .add(row.getY());
        }

        List<CanonicalRow> validated = new ArrayList<>();
        int duplicatePairs = 0;
        for (Map.Entry<String, Map<LocalDate, List<Double>>> byKey : grouped.entrySet()) {
            String key = byKey.getKey();
            for (Map.Entry<LocalDate, List<Double>> byDate : byKey.getValue().entrySet()) {
                List<Double> values = byDate.getValue();
                if (values.size() == 1) {
                    validated.add(new CanonicalRow(key, byDate.getKey(), values.get(0)));
                    continue;
                }
                duplicatePairs++;
                diagnostics.record(DiagnosticEntry.builder(DiagnosticReason.DUPLICATE_KEY_DATE)
                        .cdKey(key)
                        .ds(byDate.getKey())
                        .conflictingValues(values)
                        .message(values.size() + " values for the same key and date, policy " + effective)
                        .build());
                if (effective == DuplicatePolicy.REJECT) {
                    continue;
                }
                double folded = fold(values, effective);
                if (!Double.isFinite(folded)) {
                    diagnostics.record(nonFinite(key, byDate.getKey(), folded));
                    continue;
                }
                validated.add(new CanonicalRow(key, byDate.getKey(), folded));
            }
        }

        if (duplicatePairs > 0) {
            logger.warn("{} duplicate key/date pairs found, policy {}", duplicatePairs, effective);
        }
        logger.info("Validated {} of {} rows", validated.size(), rows.size());
        return new ValidationResult(CanonicalSeries.fromValidatedRows(validated), diagnostics.toDiagnostics());
    }

    private static double fold(List<Double> values, DuplicatePolicy policy) {
        switch (policy) {
            case SUM:
                return sum(values);
            case MEAN:
                return sum(values) / values.size();
            case LAST_WINS:
                return values.get(values.size() - 1);
            default:
                throw new IllegalArgumentException("Policy does not fold duplicates: " + policy);
        }
    }

    private static double sum(List<Double> values) {
        double total = 0.0;
        for (Double value : values) {
            total += value;
        }
        return total;
    }

    private static DiagnosticEntry nonFinite(String key, LocalDate ds, double y) {
        return DiagnosticEntry.builder(DiagnosticReason.NON_FINITE_VALUE)
                .cdKey(key)
                .ds(ds)
                .rawValue(String.valueOf(y))
                .message("value is not finite")
                .build();
    }
}
