package com.bmsedge.seriesprep.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable report of what was dropped or flagged, keyed by reason. Counts are exact,
 * samples are capped per reason.
 */
@Getter
public final class Diagnostics {

    private final Map<DiagnosticReason, Integer> counts;
    private final Map<DiagnosticReason, List<DiagnosticEntry>> samples;
    private final List<DiagnosticWarning> warnings;

    Diagnostics(Map<DiagnosticReason, Integer> counts,
                Map<DiagnosticReason, List<DiagnosticEntry>> samples,
                List<DiagnosticWarning> warnings) {
        EnumMap<DiagnosticReason, Integer> countCopy = new EnumMap<>(DiagnosticReason.class);
        countCopy.putAll(counts);
        EnumMap<DiagnosticReason, List<DiagnosticEntry>> sampleCopy = new EnumMap<>(DiagnosticReason.class);
        for (Map.Entry<DiagnosticReason, List<DiagnosticEntry>> entry : samples.entrySet()) {
            sampleCopy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.counts = Collections.unmodifiableMap(countCopy);
        this.samples = Collections.unmodifiableMap(sampleCopy);
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static Diagnostics empty() {
        return new DiagnosticsCollector(0).toDiagnostics();
    }

    public int count(DiagnosticReason reason) {
        return counts.getOrDefault(reason, 0);
    }

    public int getTotalIssues() {
        int total = 0;
        for (Integer count : counts.values()) {
            total += count;
        }
        return total;
    }

    public List<DiagnosticEntry> samplesFor(DiagnosticReason reason) {
        return samples.getOrDefault(reason, Collections.emptyList());
    }

    public boolean hasWarning(String code) {
        for (DiagnosticWarning warning : warnings) {
            if (warning.getCode().equals(code)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Combines two reports; sample caps are kept by the receiving collector.
     */
    public Diagnostics merge(Diagnostics other, int sampleLimit) {
        DiagnosticsCollector collector = new DiagnosticsCollector(sampleLimit);
        collector.addAll(this);
        collector.addAll(other);
        return collector.toDiagnostics();
    }
}
