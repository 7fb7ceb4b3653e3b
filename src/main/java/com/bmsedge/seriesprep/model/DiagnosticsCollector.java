package com.bmsedge.seriesprep.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator owned by a single stage or shard. Never shared between threads.
 */
public final class DiagnosticsCollector {

    private final int sampleLimit;
    private final Map<DiagnosticReason, Integer> counts = new EnumMap<>(DiagnosticReason.class);
    private final Map<DiagnosticReason, List<DiagnosticEntry>> samples = new EnumMap<>(DiagnosticReason.class);
    private final List<DiagnosticWarning> warnings = new ArrayList<>();

    public DiagnosticsCollector(int sampleLimit) {
        this.sampleLimit = Math.max(0, sampleLimit);
    }

    public void record(DiagnosticEntry entry) {
        counts.merge(entry.getReason(), 1, Integer::sum);
        List<DiagnosticEntry> list = samples.computeIfAbsent(entry.getReason(), r -> new ArrayList<>());
        if (list.size() < sampleLimit) {
            list.add(entry);
        }
    }

    public void warn(String code, String message) {
        warnings.add(new DiagnosticWarning(code, message));
    }

    public void addAll(Diagnostics diagnostics) {
        for (Map.Entry<DiagnosticReason, Integer> entry : diagnostics.getCounts().entrySet()) {
            counts.merge(entry.getKey(), entry.getValue(), Integer::sum);
        }
        for (Map.Entry<DiagnosticReason, List<DiagnosticEntry>> entry : diagnostics.getSamples().entrySet()) {
            List<DiagnosticEntry> list = samples.computeIfAbsent(entry.getKey(), r -> new ArrayList<>());
            for (DiagnosticEntry sample : entry.getValue()) {
                if (list.size() >= sampleLimit) {
                    break;
                }
                list.add(sample);
            }
        }
        warnings.addAll(diagnostics.getWarnings());
    }

    public int count(DiagnosticReason reason) {
        return counts.getOrDefault(reason, 0);
    }

    public Diagnostics toDiagnostics() {
        return new Diagnostics(counts, samples, warnings);
    }
}
