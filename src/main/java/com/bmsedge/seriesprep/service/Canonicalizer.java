package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.config.PipelineProperties;
import com.bmsedge.seriesprep.exception.BusinessException;
import com.bmsedge.seriesprep.exception.PipelineCancelledException;
import com.bmsedge.seriesprep.model.CanonicalRow;
import com.bmsedge.seriesprep.model.CanonicalizationResult;
import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.DiagnosticEntry;
import com.bmsedge.seriesprep.model.DiagnosticReason;
import com.bmsedge.seriesprep.model.DiagnosticsCollector;
import com.bmsedge.seriesprep.model.MappingSpec;
import com.bmsedge.seriesprep.model.ParseResult;
import com.bmsedge.seriesprep.model.RawColumn;
import com.bmsedge.seriesprep.model.RawTable;
import com.bmsedge.seriesprep.model.ShapeClassification;
import com.bmsedge.seriesprep.util.DateTokenParser;
import com.bmsedge.seriesprep.util.KeyBuilder;
import com.bmsedge.seriesprep.util.NumericValueParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Reshapes a mapped table into canonical rows. The table is only read; bad cells become
 * diagnostics and are left out, never coerced.
 *
 * <p>Long tables emit one row per input row. Wide tables emit one row per (row, date header) cell,
 * header by header. Output is neither de-duplicated nor sorted.</p>
 *
 * <p>Above {@code parallelThreshold} cells the work is split into shards (row ranges for long
 * tables, header groups for wide ones) on the canonicalizer executor. Shards write private
 * partitions that are concatenated in shard order, so the result equals the sequential one.</p>
 */
@Component
public class Canonicalizer {

    private static final Logger logger = LoggerFactory.getLogger(Canonicalizer.class);

    // Interrupt checks happen once per batch of rows
    private static final int CANCEL_CHECK_INTERVAL = 1024;

    private final PipelineProperties properties;
    private final AsyncTaskExecutor executor;

    public Canonicalizer(PipelineProperties properties,
                         @Qualifier("canonicalizerExecutor") AsyncTaskExecutor executor) {
        this.properties = properties;
        this.executor = executor;
    }

    public CanonicalizationResult canonicalize(RawTable table, ShapeClassification classification,
                                               MappingSpec mapping) {
        DateTokenParser dates = new DateTokenParser(properties.isDayFirst());
        KeyBuilder keyBuilder = new KeyBuilder(table, mapping.getKeyColumns(),
                mapping.getKeySeparator(), properties.getNullKeyToken());
        logger.debug("Canonicalizing {} rows as {} (detected {})", table.getRowCount(), mapping.getShape(),
                classification != null ? classification.getShape() : null);

        CanonicalizationResult result = mapping.isWide()
                ? canonicalizeWide(table, mapping, dates, keyBuilder)
                : canonicalizeLong(table, mapping, dates, keyBuilder);
        logger.info("Canonicalized {} rows into {} observations ({} issues)",
                table.getRowCount(), result.getRows().size(), result.getDiagnostics().getTotalIssues());
        return result;
    }

    private CanonicalizationResult canonicalizeLong(RawTable table, MappingSpec mapping,
                                                    DateTokenParser dates, KeyBuilder keyBuilder) {
        RawColumn dateColumn = table.getColumn(mapping.getDateSource().getColumn());
        RawColumn valueColumn = table.getColumn(mapping.getValueSource().getColumn());
        int rowCount = table.getRowCount();

        List<Callable<Partition>> shards = new ArrayList<>();
        int shardSize = useParallel((long) rowCount * 2) ? Math.max(1, properties.getShardSize()) : Math.max(1, rowCount);
        for (int start = 0; start < rowCount; start += shardSize) {
            final int from = start;
            final int to = Math.min(rowCount, start + shardSize);
            shards.add(() -> longShard(from, to, dateColumn, valueColumn, dates, keyBuilder));
        }
        return assemble(shards, new DiagnosticsCollector(properties.getDiagnosticSampleLimit()));
    }

    private Partition longShard(int from, int to, RawColumn dateColumn, RawColumn valueColumn,
                                DateTokenParser dates, KeyBuilder keyBuilder) {
        Partition partition = new Partition(properties.getDiagnosticSampleLimit());
        for (int row = from; row < to; row++) {
            checkCancelled(row - from);
            String key = keyBuilder.keyFor(row);

            CellValue dateCell = dateColumn.get(row);
            ParseResult<LocalDate> date = dates.parseValue(dateCell);
            if (date.isFailure()) {
                partition.reject(date, row, dateColumn.getName(), key, null, dateCell);
                continue;
            }

            CellValue valueCell = valueColumn.get(row);
            ParseResult<Double> value = NumericValueParser.parse(valueCell);
            if (value.isFailure()) {
                partition.reject(value, row, valueColumn.getName(), key, date.getValue(), valueCell);
                continue;
            }
            partition.rows.add(new CanonicalRow(key, date.getValue(), value.getValue()));
        }
        return partition;
    }

    private CanonicalizationResult canonicalizeWide(RawTable table, MappingSpec mapping,
                                                    DateTokenParser dates, KeyBuilder keyBuilder) {
        DiagnosticsCollector headerIssues = new DiagnosticsCollector(properties.getDiagnosticSampleLimit());
        List<RawColumn> headerColumns = new ArrayList<>();
        List<LocalDate> headerDates = new ArrayList<>();
        for (String header : mapping.getDateSource().getColumns()) {
            ParseResult<LocalDate> parsed = dates.parseHeader(header);
            if (parsed.isFailure()) {
                headerIssues.record(DiagnosticEntry.builder(DiagnosticReason.UNPARSEABLE_HEADER)
                        .column(header)
                        .rawValue(header)
                        .message("header is not a date; column skipped")
                        .build());
                logger.debug("Skipping header '{}': {}", header, parsed.getDetail());
                continue;
            }
            headerColumns.add(table.getColumn(header));
            headerDates.add(parsed.getValue());
        }

        int rowCount = table.getRowCount();
        String[] keys = new String[rowCount];
        for (int row = 0; row < rowCount; row++) {
            keys[row] = keyBuilder.keyFor(row);
        }

        long cells = (long) rowCount * headerColumns.size();
        int headersPerShard = headerColumns.size();
        if (useParallel(cells) && rowCount > 0) {
            headersPerShard = Math.max(1, properties.getShardSize() / rowCount);
        }
        headersPerShard = Math.max(1, headersPerShard);

        List<Callable<Partition>> shards = new ArrayList<>();
        for (int start = 0; start < headerColumns.size(); start += headersPerShard) {
            final List<RawColumn> columns = headerColumns.subList(start, Math.min(headerColumns.size(), start + headersPerShard));
            final List<LocalDate> columnDates = headerDates.subList(start, Math.min(headerDates.size(), start + headersPerShard));
            shards.add(() -> wideShard(columns, columnDates, keys));
        }
        return assemble(shards, headerIssues);
    }

    private Partition wideShard(List<RawColumn> columns, List<LocalDate> columnDates, String[] keys) {
        Partition partition = new Partition(properties.getDiagnosticSampleLimit());
        int processed = 0;
        for (int c = 0; c < columns.size(); c++) {
            RawColumn column = columns.get(c);
            LocalDate ds = columnDates.get(c);
            for (int row = 0; row < keys.length; row++) {
                checkCancelled(processed++);
                CellValue cell = column.get(row);
                ParseResult<Double> value = NumericValueParser.parse(cell);
                if (value.isFailure()) {
                    partition.reject(value, row, column.getName(), keys[row], ds, cell);
                    continue;
                }
                partition.rows.add(new CanonicalRow(keys[row], ds, value.getValue()));
            }
        }
        return partition;
    }

    private boolean useParallel(long cells) {
        return executor != null && cells > properties.getParallelThreshold();
    }

    private CanonicalizationResult assemble(List<Callable<Partition>> shards, DiagnosticsCollector diagnostics) {
        List<CanonicalRow> rows = new ArrayList<>();
        for (Partition partition : runShards(shards)) {
            rows.addAll(partition.rows);
            diagnostics.addAll(partition.diagnostics.toDiagnostics());
        }
        return new CanonicalizationResult(rows, diagnostics.toDiagnostics());
    }

    private List<Partition> runShards(List<Callable<Partition>> shards) {
        List<Partition> partitions = new ArrayList<>();
        if (shards.size() <= 1 || executor == null) {
            for (Callable<Partition> shard : shards) {
                partitions.add(callInline(shard));
            }
            return partitions;
        }

        logger.info("Canonicalizing in {} shards", shards.size());
        List<Future<Partition>> futures = new ArrayList<>();
        for (Callable<Partition> shard : shards) {
            futures.add(executor.submit(shard));
        }
        try {
            for (Future<Partition> future : futures) {
                partitions.add(future.get());
            }
            return partitions;
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            logger.warn("Canonicalization cancelled while waiting for shards");
            throw new PipelineCancelledException("Canonicalization was cancelled", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new BusinessException("Canonicalization shard failed: " + cause.getMessage(), cause);
        }
    }

    private static Partition callInline(Callable<Partition> shard) {
        try {
            return shard.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new BusinessException("Canonicalization failed: " + e.getMessage(), e);
        }
    }

    private static void cancelAll(List<Future<Partition>> futures) {
        for (Future<Partition> future : futures) {
            future.cancel(true);
        }
    }

    private static void checkCancelled(int processed) {
        if (processed % CANCEL_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
            logger.warn("Canonicalization shard interrupted, discarding partial rows");
            throw new PipelineCancelledException("Canonicalization was cancelled");
        }
    }

    /**
     * Rows and diagnostics written by one shard only.
     */
    private static final class Partition {
        private final List<CanonicalRow> rows = new ArrayList<>();
        private final DiagnosticsCollector diagnostics;

        private Partition(int sampleLimit) {
            this.diagnostics = new DiagnosticsCollector(sampleLimit);
        }

        private void reject(ParseResult<?> failure, int row, String column, String key, LocalDate ds, CellValue cell) {
            diagnostics.record(DiagnosticEntry.builder(failure.getFailureReason())
                    .rowIndex(row)
                    .column(column)
                    .cdKey(key)
                    .ds(ds)
                    .rawValue(cell.isMissing() ? null : cell.asText())
                    .message(failure.getDetail())
                    .build());
        }
    }
}
