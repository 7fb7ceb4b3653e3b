package com.bmsedge.seriesprep.controller;

import com.bmsedge.seriesprep.config.PipelineProperties;
import com.bmsedge.seriesprep.exception.GlobalExceptionHandler;
import com.bmsedge.seriesprep.service.Canonicalizer;
import com.bmsedge.seriesprep.service.ColumnClassifier;
import com.bmsedge.seriesprep.service.ColumnMapper;
import com.bmsedge.seriesprep.service.ConversionPipelineService;
import com.bmsedge.seriesprep.service.FrequencyInferencer;
import com.bmsedge.seriesprep.service.SeriesValidator;
import com.bmsedge.seriesprep.service.ShapeDetector;
import com.bmsedge.seriesprep.service.TableLoaderService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.ByteArrayHttpMessageConverter;
import org.springframework.http.converter.ResourceHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests running the real loader and pipeline behind a standalone MockMvc
 */
class SeriesConversionControllerTest {

    private static final String WIDE_CSV = "Store,Jan-2024,Feb-2024\nA,10,12\nB,5,7\n";

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        PipelineProperties properties = new PipelineProperties();
        ColumnClassifier columnClassifier = new ColumnClassifier(properties);
        ConversionPipelineService pipeline = new ConversionPipelineService(properties,
                columnClassifier,
                new ShapeDetector(properties, columnClassifier),
                new ColumnMapper(properties, columnClassifier),
                new FrequencyInferencer(properties),
                new Canonicalizer(properties, null),
                new SeriesValidator(properties));

        SeriesConversionController controller = new SeriesConversionController();
        ReflectionTestUtils.setField(controller, "tableLoaderService", new TableLoaderService());
        ReflectionTestUtils.setField(controller, "conversionPipelineService", pipeline);
        ReflectionTestUtils.setField(controller, "objectMapper", objectMapper);
        ReflectionTestUtils.setField(controller, "validator",
                Validation.buildDefaultValidatorFactory().getValidator());

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new ByteArrayHttpMessageConverter(), new ResourceHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    private static MockMultipartFile csv(String name, String content) {
        return new MockMultipartFile("file", name, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should convert an uploaded wide table")
    void shouldConvertUpload() throws Exception {
        mockMvc.perform(multipart("/api/series/convert").file(csv("sales.csv", WIDE_CSV)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.inputRows").value(2))
                .andExpect(jsonPath("$.outputRows").value(4))
                .andExpect(jsonPath("$.keyCount").value(2))
                .andExpect(jsonPath("$.mapping.shape").value("WIDE"))
                .andExpect(jsonPath("$.rows[0].cdKey").value("A"))
                .andExpect(jsonPath("$.rows[0].ds").value("2024-01-01"))
                .andExpect(jsonPath("$.rows[3].y").value(7.0));
    }

    @Test
    @DisplayName("Should download the canonical CSV with a diagnostics header")
    void shouldDownloadCanonicalCsv() throws Exception {
        mockMvc.perform(multipart("/api/series/convert/csv").file(csv("sales.csv", WIDE_CSV)))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"sales_canonical.csv\""))
                .andExpect(header().string("X-Diagnostics-Total", "0"))
                .andExpect(content().string("cd_key,ds,y\nA,2024-01-01,10.0\nA,2024-02-01,12.0\n"
                        + "B,2024-01-01,5.0\nB,2024-02-01,7.0\n"));
    }

    @Test
    @DisplayName("Should apply a declared mapping and duplicate policy")
    void shouldApplyDeclaredMapping() throws Exception {
        String content = "day,amount,sku\n2024-01-01,3,x\n2024-01-01,4,x\n2024-01-02,5,x\n";

        mockMvc.perform(multipart("/api/series/convert")
                        .file(csv("orders.csv", content))
                        .param("mapping", "{\"shape\":\"long\",\"keyColumns\":[\"sku\"],\"dateColumn\":\"day\"}")
                        .param("duplicatePolicy", "sum"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outputRows").value(2))
                .andExpect(jsonPath("$.rows[0].y").value(7.0))
                .andExpect(jsonPath("$.diagnostics.counts.DUPLICATE_KEY_DATE").value(1));
    }

    @Test
    @DisplayName("Should answer 422 with the missing roles when no key column can be found")
    void shouldReportUnresolvedMapping() throws Exception {
        mockMvc.perform(multipart("/api/series/convert").file(csv("keyless.csv", "date,sales\n2024-01-01,1\n")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.missingRoles", contains("keyColumns")));
    }

    @Test
    @DisplayName("Should answer 422 when the layout cannot be told apart")
    void shouldReportAmbiguousShape() throws Exception {
        mockMvc.perform(multipart("/api/series/convert").file(csv("items.csv", "name,qty\nwidget,5\n")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Ambiguous Table Shape"))
                .andExpect(jsonPath("$.missingRoles", contains("shape")));
    }

    @Test
    @DisplayName("Should reject malformed or oversized mapping declarations")
    void shouldRejectBadMapping() throws Exception {
        mockMvc.perform(multipart("/api/series/convert")
                        .file(csv("sales.csv", WIDE_CSV))
                        .param("mapping", "{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Business Logic Error"));

        mockMvc.perform(multipart("/api/series/convert")
                        .file(csv("sales.csv", WIDE_CSV))
                        .param("mapping", "{\"keySeparator\":\"<<<<<<<<>>>>>>>>\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        mockMvc.perform(multipart("/api/series/convert")
                        .file(csv("sales.csv", WIDE_CSV))
                        .param("duplicatePolicy", "newest"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Argument"));
    }

    @Test
    @DisplayName("Should reject unsupported file types")
    void shouldRejectUnsupportedFile() throws Exception {
        mockMvc.perform(multipart("/api/series/convert").file(csv("notes.txt", WIDE_CSV)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unreadable File"));
    }

    @Test
    @DisplayName("Should profile a table that still needs a key column")
    void shouldProfileUpload() throws Exception {
        mockMvc.perform(multipart("/api/series/profile")
                        .file(csv("keyless.csv", "date,sales\n2024-01-01,1\n2024-01-02,2\n2024-01-03,3\n")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shape").value("LONG"))
                .andExpect(jsonPath("$.mappingResolved").value(false))
                .andExpect(jsonPath("$.missingRoles", contains("keyColumns")))
                .andExpect(jsonPath("$.dateCandidates", contains("date")))
                .andExpect(jsonPath("$.frequency.frequency").value("DAILY"));
    }

    @Test
    @DisplayName("Should describe the canonical schema")
    void shouldReturnSchema() throws Exception {
        mockMvc.perform(get("/api/series/schema"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.columns.ds").exists())
                .andExpect(jsonPath("$.frequencies", hasItem("MS")))
                .andExpect(jsonPath("$.duplicatePolicies", hasItem("REJECT")));
    }
}
