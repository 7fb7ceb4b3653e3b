package com.bmsedge.seriesprep.controller;

import com.bmsedge.seriesprep.dto.ConversionResponse;
import com.bmsedge.seriesprep.dto.MappingOverrideRequest;
import com.bmsedge.seriesprep.dto.ProfileResponse;
import com.bmsedge.seriesprep.exception.BusinessException;
import com.bmsedge.seriesprep.model.ConversionResult;
import com.bmsedge.seriesprep.model.DuplicatePolicy;
import com.bmsedge.seriesprep.model.MappingOverride;
import com.bmsedge.seriesprep.model.ProfileResult;
import com.bmsedge.seriesprep.model.RawTable;
import com.bmsedge.seriesprep.service.ConversionPipelineService;
import com.bmsedge.seriesprep.service.TableLoaderService;
import com.bmsedge.seriesprep.util.CanonicalCsvWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * REST Controller for turning uploaded tables into canonical (cd_key, ds, y) series
 */
@RestController
@RequestMapping("/api/series")
@CrossOrigin(origins = "*", maxAge = 3600)
public class SeriesConversionController {

    private static final Logger logger = LoggerFactory.getLogger(SeriesConversionController.class);

    @Autowired
    private TableLoaderService tableLoaderService;

    @Autowired
    private ConversionPipelineService conversionPipelineService;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private Validator validator;

    /**
     * Profile an uploaded table without converting it
     * POST /api/series/profile
     *
     * Returns the detected layout, column roles, ranked date columns, frequency and either
     * the resolved mapping or the roles that still need declaring.
     */
    @PostMapping("/profile")
    public ResponseEntity<ProfileResponse> profile(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "mapping", required = false) String mapping) {

        logger.info("Received profile request: file={}, size={}", file.getOriginalFilename(), file.getSize());

        RawTable table = tableLoaderService.load(file);
        ProfileResult result = conversionPipelineService.profile(table, parseMapping(mapping));
        return ResponseEntity.ok(ProfileResponse.from(result));
    }

    /**
     * Convert an uploaded table into the canonical series
     * POST /api/series/convert
     */
    @PostMapping("/convert")
    public ResponseEntity<ConversionResponse> convert(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "mapping", required = false) String mapping,
            @RequestParam(value = "duplicatePolicy", required = false) String duplicatePolicy) {

        logger.info("Received conversion request: file={}, size={}, duplicatePolicy={}",
                file.getOriginalFilename(), file.getSize(), duplicatePolicy);

        ConversionResult result = runConversion(file, mapping, duplicatePolicy);

        logger.info("Conversion result: rows={}, keys={}, issues={}",
                result.getSeries().size(), result.getSeries().keys().size(),
                result.getDiagnostics().getTotalIssues());
        return ResponseEntity.ok(ConversionResponse.from(result));
    }

    /**
     * Convert an uploaded table and download the canonical CSV
     * POST /api/series/convert/csv
     */
    @PostMapping("/convert/csv")
    public ResponseEntity<ByteArrayResource> convertToCsv(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "mapping", required = false) String mapping,
            @RequestParam(value = "duplicatePolicy", required = false) String duplicatePolicy) {

        logger.info("Received CSV conversion request: file={}", file.getOriginalFilename());

        ConversionResult result = runConversion(file, mapping, duplicatePolicy);

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(buffer, StandardCharsets.UTF_8)) {
            CanonicalCsvWriter.write(result.getSeries(), writer);
        } catch (IOException e) {
            logger.error("Failed to write canonical CSV: {}", e.getMessage(), e);
            throw new BusinessException("Failed to write canonical CSV: " + e.getMessage(), e);
        }
        byte[] csvBytes = buffer.toByteArray();

        String filename = baseName(file.getOriginalFilename()) + "_canonical.csv";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .header("X-Diagnostics-Total", String.valueOf(result.getDiagnostics().getTotalIssues()))
                .contentType(MediaType.parseMediaType("text/csv"))
                .contentLength(csvBytes.length)
                .body(new ByteArrayResource(csvBytes));
    }

    /**
     * Canonical schema contract and accepted input tokens
     * GET /api/series/schema
     */
    @GetMapping("/schema")
    public ResponseEntity<Map<String, Object>> getSchema() {
        logger.debug("Canonical schema requested");

        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("cd_key", "text: key columns joined by the key separator (default '|')");
        columns.put("ds", "date: ISO-8601 yyyy-MM-dd, first day of the period for period tokens");
        columns.put("y", "float: finite numeric observation");

        Map<String, Object> schema = new HashMap<>();
        schema.put("columns", columns);
        schema.put("order", "cd_key ascending, then ds ascending; (cd_key, ds) is unique");
        schema.put("shapes", Arrays.asList(
                "WIDE: one row per entity, one column per date or period",
                "LONG: one row per entity and date, with a date column and a value column"));
        schema.put("dateFormats", Arrays.asList(
                "2024-01-31", "31/01/2024", "01/31/2024", "20240131", "31 Jan 2024", "Jan 31, 2024",
                "Jan-2024", "January 2024", "2024-01", "01/2024",
                "2024-Q1", "Q1 2024", "2024-W05", "FY2024", "FY2024-P03", "2024 (headers only)"));
        schema.put("frequencies", Arrays.asList("D", "W", "MS", "QS", "YS"));
        schema.put("duplicatePolicies", Arrays.asList(DuplicatePolicy.values()));
        schema.put("success", true);
        return ResponseEntity.ok(schema);
    }

    private ConversionResult runConversion(MultipartFile file, String mapping, String duplicatePolicy) {
        MappingOverride override = parseMapping(mapping);
        DuplicatePolicy policy = parsePolicy(duplicatePolicy);
        RawTable table = tableLoaderService.load(file);
        return conversionPipelineService.convert(table, override, policy);
    }

    private MappingOverride parseMapping(String mapping) {
        if (mapping == null || mapping.trim().isEmpty()) {
            return MappingOverride.none();
        }
        MappingOverrideRequest request;
        try {
            request = objectMapper.readValue(mapping, MappingOverrideRequest.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException("Invalid mapping JSON: " + e.getOriginalMessage(), e);
        }
        Set<ConstraintViolation<MappingOverrideRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return request.toOverride();
    }

    private static DuplicatePolicy parsePolicy(String duplicatePolicy) {
        if (duplicatePolicy == null || duplicatePolicy.trim().isEmpty()) {
            return null;
        }
        try {
            return DuplicatePolicy.valueOf(duplicatePolicy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown duplicate policy '" + duplicatePolicy
                    + "'. Expected one of " + Arrays.toString(DuplicatePolicy.values()));
        }
    }

    private static String baseName(String fileName) {
        if (fileName == null || fileName.trim().isEmpty()) {
            return "series";
        }
        String name = fileName.replaceAll(".*[/\\\\]", "");
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
