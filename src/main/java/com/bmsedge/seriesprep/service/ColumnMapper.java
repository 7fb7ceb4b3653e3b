package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.config.PipelineProperties;
import com.bmsedge.seriesprep.exception.MappingException;
import com.bmsedge.seriesprep.exception.ShapeDetectionAmbiguousException;
import com.bmsedge.seriesprep.model.ColumnProfile;
import com.bmsedge.seriesprep.model.ColumnRole;
import com.bmsedge.seriesprep.model.MappingOverride;
import com.bmsedge.seriesprep.model.MappingSpec;
import com.bmsedge.seriesprep.model.RawTable;
import com.bmsedge.seriesprep.model.ShapeClassification;
import com.bmsedge.seriesprep.model.ShapeType;
import com.bmsedge.seriesprep.model.TableProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves column roles by merging declared roles with detection. A declared role always wins.
 */
@Component
public class ColumnMapper {

    private static final Logger logger = LoggerFactory.getLogger(ColumnMapper.class);

    private final PipelineProperties properties;
    private final ColumnClassifier columnClassifier;

    public ColumnMapper(PipelineProperties properties, ColumnClassifier columnClassifier) {
        this.properties = properties;
        this.columnClassifier = columnClassifier;
    }

    public MappingSpec buildMapping(ShapeClassification classification, MappingOverride override, RawTable table) {
        return buildMapping(classification, override, table, columnClassifier.classify(table));
    }

    public MappingSpec buildMapping(ShapeClassification classification, MappingOverride override,
                                    RawTable table, TableProfile profile) {
        MappingOverride declared = override != null ? override : MappingOverride.none();

        List<String> invalid = unknownColumns(declared, table);
        if (!invalid.isEmpty()) {
            throw new MappingException("Declared columns do not exist in the table: " + invalid,
                    new ArrayList<>(), invalid);
        }

        ShapeType shape = resolveShape(classification, declared);
        String separator = declared.getKeySeparator() != null
                ? declared.getKeySeparator() : properties.getKeySeparator();

        List<String> declaredKeys = null;
        if (declared.hasKeyColumns()) {
            declaredKeys = normalizeKeys(declared.getKeyColumns());
            if (declaredKeys.isEmpty()) {
                throw new MappingException("Declared key column list is empty",
                        listOf(MappingException.ROLE_KEY_COLUMNS), new ArrayList<>());
            }
        }

        MappingSpec mapping = shape == ShapeType.WIDE
                ? wideMapping(classification, declared, declaredKeys, separator, profile)
                : longMapping(classification, declared, declaredKeys, separator, profile);
        logger.info("Mapping resolved: {}", mapping);
        return mapping;
    }

    /**
     * A declared shape wins, then the shape implied by declared roles: a date or value column means
     * LONG, date header columns mean WIDE. Detection decides only when nothing was declared.
     */
    private ShapeType resolveShape(ShapeClassification classification, MappingOverride declared) {
        boolean longRoles = declared.hasDateColumn() || declared.hasValueColumn();
        boolean wideRoles = declared.hasDateHeaderColumns();
        if (longRoles && wideRoles) {
            throw new MappingException("Declared date/value columns and date header columns describe different layouts",
                    new ArrayList<>(), conflictingRoles(declared));
        }

        ShapeType implied = wideRoles ? ShapeType.WIDE : longRoles ? ShapeType.LONG : null;
        if (declared.hasShape()) {
            if (implied != null && implied != declared.getShape()) {
                throw new MappingException(String.format("Declared %s layout conflicts with roles that imply %s",
                        declared.getShape(), implied), new ArrayList<>(), conflictingRoles(declared));
            }
            warnIfContradicted(classification, declared.getShape());
            return declared.getShape();
        }
        if (implied != null) {
            warnIfContradicted(classification, implied);
            return implied;
        }
        if (!classification.isAmbiguous()) {
            return classification.getShape();
        }
        throw new ShapeDetectionAmbiguousException(classification, properties.getConfidenceFloor());
    }

    private static void warnIfContradicted(ShapeClassification classification, ShapeType resolved) {
        if (!classification.isAmbiguous() && classification.getShape() != resolved) {
            logger.warn("Declared mapping forces {} over detected shape {} (confidence {})",
                    resolved, classification.getShape(), String.format("%.2f", classification.getConfidence()));
        }
    }

    private static List<String> conflictingRoles(MappingOverride declared) {
        List<String> columns = new ArrayList<>();
        if (declared.hasDateColumn()) {
            columns.add(declared.getDateColumn());
        }
        if (declared.hasValueColumn()) {
            columns.add(declared.getValueColumn());
        }
        if (declared.hasDateHeaderColumns()) {
            columns.addAll(declared.getDateHeaderColumns());
        }
        return columns;
    }

    private MappingSpec longMapping(ShapeClassification classification, MappingOverride declared,
                                    List<String> declaredKeys, String separator, TableProfile profile) {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        String dateColumn = declared.hasDateColumn() ? declared.getDateColumn() : classification.getBestDateColumn();
        if (dateColumn != null && declaredKeys != null && declaredKeys.contains(dateColumn)) {
            if (declared.hasDateColumn()) {
                invalid.add(dateColumn);
            }
            dateColumn = null;
        }
        if (dateColumn == null && invalid.isEmpty()) {
            missing.add(MappingException.ROLE_DATE_COLUMN);
        }

        String valueColumn;
        if (declared.hasValueColumn()) {
            valueColumn = declared.getValueColumn();
            if (valueColumn.equals(dateColumn) || (declaredKeys != null && declaredKeys.contains(valueColumn))) {
                invalid.add(valueColumn);
            }
        } else {
            valueColumn = pickValueColumn(profile, dateColumn, declaredKeys);
            if (valueColumn == null) {
                missing.add(MappingException.ROLE_VALUE_COLUMN);
            }
        }

        List<String> keys = declaredKeys != null ? declaredKeys
                : textColumnsExcept(profile, setOf(dateColumn, valueColumn));
        if (keys.isEmpty()) {
            missing.add(MappingException.ROLE_KEY_COLUMNS);
        }

        failIfUnresolved(missing, invalid);
        return MappingSpec.longFormat(keys, separator, dateColumn, valueColumn);
    }

    private MappingSpec wideMapping(ShapeClassification classification, MappingOverride declared,
                                    List<String> declaredKeys, String separator, TableProfile profile) {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        List<String> headers = new ArrayList<>();
        if (declared.hasDateHeaderColumns()) {
            for (String header : new LinkedHashSet<>(declared.getDateHeaderColumns())) {
                if (declaredKeys != null && declaredKeys.contains(header)) {
                    invalid.add(header);
                } else {
                    headers.add(header);
                }
            }
        } else {
            for (String header : classification.getDateHeaderColumns()) {
                if (declaredKeys == null || !declaredKeys.contains(header)) {
                    headers.add(header);
                }
            }
        }
        if (headers.isEmpty() && invalid.isEmpty()) {
            missing.add(MappingException.ROLE_DATE_HEADERS);
        }

        List<String> keys = declaredKeys != null ? declaredKeys : textColumnsExcept(profile, headers);
        if (keys.isEmpty()) {
            missing.add(MappingException.ROLE_KEY_COLUMNS);
        }

        failIfUnresolved(missing, invalid);
        return MappingSpec.wideFormat(keys, separator, headers);
    }

    /**
     * Remaining numeric column with the best numeric fraction, then the most values, then table order.
     */
    private static String pickValueColumn(TableProfile profile, String dateColumn, List<String> declaredKeys) {
        List<ColumnProfile> candidates = new ArrayList<>();
        for (ColumnProfile column : profile.getColumns()) {
            String name = column.getColumnName();
            if (column.getRole() != ColumnRole.NUMERIC || name.equals(dateColumn)
                    || (declaredKeys != null && declaredKeys.contains(name))) {
                continue;
            }
            candidates.add(column);
        }
        if (candidates.isEmpty()) {
            return null;
        }
        candidates.sort(Comparator.comparingDouble(ColumnProfile::getNumericFraction).reversed()
                .thenComparing(Comparator.comparingInt(ColumnProfile::getSampledValues).reversed())
                .thenComparingInt(ColumnProfile::getColumnIndex));
        if (candidates.size() > 1) {
            logger.debug("Several value columns possible, picked '{}' out of {}",
                    candidates.get(0).getColumnName(), candidates.size());
        }
        return candidates.get(0).getColumnName();
    }

    private static List<String> textColumnsExcept(TableProfile profile, Collection<String> used) {
        List<String> keys = new ArrayList<>();
        for (String name : profile.columnsWithRole(ColumnRole.TEXT)) {
            if (!used.contains(name)) {
                keys.add(name);
            }
        }
        return keys;
    }

    private static List<String> normalizeKeys(List<String> keyColumns) {
        Set<String> keys = new LinkedHashSet<>();
        for (String key : keyColumns) {
            if (key != null && !key.trim().isEmpty()) {
                keys.add(key.trim());
            }
        }
        return new ArrayList<>(keys);
    }

    private static List<String> unknownColumns(MappingOverride declared, RawTable table) {
        Set<String> unknown = new LinkedHashSet<>();
        if (declared.hasKeyColumns()) {
            for (String key : normalizeKeys(declared.getKeyColumns())) {
                if (!table.hasColumn(key)) {
                    unknown.add(key);
                }
            }
        }
        if (declared.hasDateColumn() && !table.hasColumn(declared.getDateColumn())) {
            unknown.add(declared.getDateColumn());
        }
        if (declared.hasValueColumn() && !table.hasColumn(declared.getValueColumn())) {
            unknown.add(declared.getValueColumn());
        }
        if (declared.hasDateHeaderColumns()) {
            for (String header : declared.getDateHeaderColumns()) {
                if (!table.hasColumn(header)) {
                    unknown.add(header);
                }
            }
        }
        return new ArrayList<>(unknown);
    }

    private static void failIfUnresolved(List<String> missing, List<String> invalid) {
        if (missing.isEmpty() && invalid.isEmpty()) {
            return;
        }
        StringBuilder message = new StringBuilder("Could not resolve column mapping");
        if (!missing.isEmpty()) {
            message.append("; declare: ").append(String.join(", ", missing));
        }
        if (!invalid.isEmpty()) {
            message.append("; conflicting columns: ").append(String.join(", ", invalid));
        }
        throw new MappingException(message.toString(), missing, invalid);
    }

    private static Set<String> setOf(String... names) {
        Set<String> set = new LinkedHashSet<>();
        for (String name : names) {
            if (name != null) {
                set.add(name);
            }
        }
        return set;
    }

    private static List<String> listOf(String value) {
        List<String> list = new ArrayList<>();
        list.add(value);
        return list;
    }
}
