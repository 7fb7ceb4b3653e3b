package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.config.PipelineProperties;
import com.bmsedge.seriesprep.exception.MappingException;
import com.bmsedge.seriesprep.exception.ShapeDetectionAmbiguousException;
import com.bmsedge.seriesprep.model.CanonicalizationResult;
import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.ColumnSource;
import com.bmsedge.seriesprep.model.ConversionContext;
import com.bmsedge.seriesprep.model.ConversionResult;
import com.bmsedge.seriesprep.model.DiagnosticWarning;
import com.bmsedge.seriesprep.model.Diagnostics;
import com.bmsedge.seriesprep.model.DiagnosticsCollector;
import com.bmsedge.seriesprep.model.DuplicatePolicy;
import com.bmsedge.seriesprep.model.FrequencyLabel;
import com.bmsedge.seriesprep.model.MappingOverride;
import com.bmsedge.seriesprep.model.MappingSpec;
import com.bmsedge.seriesprep.model.ParseResult;
import com.bmsedge.seriesprep.model.ProfileResult;
import com.bmsedge.seriesprep.model.RawTable;
import com.bmsedge.seriesprep.model.ShapeClassification;
import com.bmsedge.seriesprep.model.ShapeType;
import com.bmsedge.seriesprep.model.TableProfile;
import com.bmsedge.seriesprep.model.ValidationResult;
import com.bmsedge.seriesprep.util.DateTokenParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the stages in order: classify columns, detect shape, map roles, infer frequency,
 * canonicalize, validate. Each stage hands the next a new {@link ConversionContext}.
 */
@Service
public class ConversionPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(ConversionPipelineService.class);

    private final PipelineProperties properties;
    private final ColumnClassifier columnClassifier;
    private final ShapeDetector shapeDetector;
    private final ColumnMapper columnMapper;
    private final FrequencyInferencer frequencyInferencer;
    private final Canonicalizer canonicalizer;
    private final SeriesValidator seriesValidator;

    public ConversionPipelineService(PipelineProperties properties,
                                     ColumnClassifier columnClassifier,
                                     ShapeDetector shapeDetector,
                                     ColumnMapper columnMapper,
                                     FrequencyInferencer frequencyInferencer,
                                     Canonicalizer canonicalizer,
                                     SeriesValidator seriesValidator) {
        this.properties = properties;
        this.columnClassifier = columnClassifier;
        this.shapeDetector = shapeDetector;
        this.columnMapper = columnMapper;
        this.frequencyInferencer = frequencyInferencer;
        this.canonicalizer = canonicalizer;
        this.seriesValidator = seriesValidator;
    }

    /**
     * Reports what can be inferred without converting. Unresolved roles are listed instead of thrown.
     */
    public ProfileResult profile(RawTable table, MappingOverride override) {
        ConversionContext context = detect(table, override);
        ShapeClassification classification = context.getClassification();
        List<String> candidates = shapeDetector.rankDateCandidates(context.getTableProfile());

        MappingSpec mapping = null;
        List<String> missingRoles = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        if (classification.getNotes() != null) {
            notes.add(classification.getNotes());
        }
        try {
            mapping = columnMapper.buildMapping(classification, context.getOverride(), table, context.getTableProfile());
        } catch (ShapeDetectionAmbiguousException e) {
            missingRoles.add(MappingException.ROLE_SHAPE);
            notes.add(e.getMessage());
        } catch (MappingException e) {
            missingRoles.addAll(e.getMissingRoles());
            notes.add(e.getMessage());
        }

        FrequencyLabel frequency = mapping != null
                ? frequencyInferencer.infer(datesOf(table, mapping))
                : frequencyInferencer.infer(detectedDates(table, classification));
        logger.info("Profiled table of {} rows x {} columns: {} ({})", table.getRowCount(), table.getColumnCount(),
                classification.getShape(), mapping != null ? "mapping resolved" : "missing " + missingRoles);
        return new ProfileResult(classification, context.getTableProfile().getColumns(), candidates,
                frequency, mapping, missingRoles, notes);
    }

    public ConversionResult convert(RawTable table, MappingOverride override, DuplicatePolicy policy) {
        ConversionContext context = detect(table, override);
        DiagnosticsCollector warnings = new DiagnosticsCollector(properties.getDiagnosticSampleLimit());

        context = context.withMapping(columnMapper.buildMapping(context.getClassification(), context.getOverride(),
                table, context.getTableProfile()));
        String contradiction = overrideContradiction(context);
        if (contradiction != null) {
            warnings.warn(DiagnosticWarning.MAPPING_OVERRIDE, contradiction);
        }

        context = context.withFrequency(frequencyInferencer.infer(datesOf(table, context.getMapping())));
        FrequencyLabel frequency = context.getFrequency();
        if (frequency.isInconclusive()) {
            logger.warn("Frequency inconclusive: {}", frequency.getNotes());
            warnings.warn(DiagnosticWarning.FREQUENCY_INCONCLUSIVE,
                    frequency.getNotes() != null ? frequency.getNotes() : "no cadence dominates the dates");
        }

        CanonicalizationResult canonical = canonicalizer.canonicalize(table, context.getClassification(),
                context.getMapping());
        ValidationResult validated = seriesValidator.validate(canonical.getRows(),
                policy != null ? policy : properties.getDuplicatePolicy());

        Diagnostics diagnostics = canonical.getDiagnostics()
                .merge(validated.getDiagnostics(), properties.getDiagnosticSampleLimit())
                .merge(warnings.toDiagnostics(), properties.getDiagnosticSampleLimit());
        logger.info("Converted {} input rows into {} observations for {} keys at {} frequency",
                table.getRowCount(), validated.getSeries().size(), validated.getSeries().keys().size(),
                frequency.getFrequency());
        return new ConversionResult(validated.getSeries(), diagnostics, context.getClassification(),
                context.getMapping(), frequency, table.getRowCount());
    }

    private ConversionContext detect(RawTable table, MappingOverride override) {
        TableProfile tableProfile = columnClassifier.classify(table);
        ConversionContext context = ConversionContext.start(table, tableProfile, override);
        return context.withClassification(shapeDetector.detect(table, tableProfile));
    }

    private static String overrideContradiction(ConversionContext context) {
        ShapeClassification classification = context.getClassification();
        MappingSpec mapping = context.getMapping();
        if (classification.isAmbiguous() || classification.getShape() == mapping.getShape()) {
            return null;
        }
        return String.format("Declared %s layout overrides detected %s (confidence %.2f)",
                mapping.getShape(), classification.getShape(), classification.getConfidence());
    }

    private List<LocalDate> datesOf(RawTable table, MappingSpec mapping) {
        return datesOf(table, mapping.getDateSource());
    }

    private List<LocalDate> datesOf(RawTable table, ColumnSource source) {
        DateTokenParser dates = new DateTokenParser(properties.isDayFirst());
        List<LocalDate> parsed = new ArrayList<>();
        if (source.getKind() == ColumnSource.Kind.HEADERS) {
            for (String header : source.getColumns()) {
                addIfParsed(parsed, dates.parseHeader(header));
            }
            return parsed;
        }
        for (CellValue cell : table.getColumn(source.getColumn()).getValues()) {
            addIfParsed(parsed, dates.parseValue(cell));
        }
        return parsed;
    }

    // Best guess used by profiling when no mapping could be built
    private List<LocalDate> detectedDates(RawTable table, ShapeClassification classification) {
        ShapeType likely = classification.isAmbiguous() ? classification.getSuggestedShape() : classification.getShape();
        if (likely == ShapeType.WIDE && classification.getDateHeaderCount() > 0) {
            return datesOf(table, ColumnSource.headers(classification.getDateHeaderColumns()));
        }
        if (classification.getBestDateColumn() != null) {
            return datesOf(table, ColumnSource.column(classification.getBestDateColumn()));
        }
        return new ArrayList<>();
    }

    private static void addIfParsed(List<LocalDate> dates, ParseResult<LocalDate> result) {
        if (result.isSuccess()) {
            dates.add(result.getValue());
        }
    }
}
