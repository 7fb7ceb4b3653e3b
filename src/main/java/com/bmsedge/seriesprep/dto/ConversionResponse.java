package com.bmsedge.seriesprep.dto;

import com.bmsedge.seriesprep.model.CanonicalRow;
import com.bmsedge.seriesprep.model.ConversionResult;
import com.bmsedge.seriesprep.model.Diagnostics;
import com.bmsedge.seriesprep.model.FrequencyLabel;
import com.bmsedge.seriesprep.model.MappingSpec;
import com.bmsedge.seriesprep.model.ShapeClassification;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Setter
@Getter
public class ConversionResponse {

    private boolean success;
    private String message;

    // Summary
    private int inputRows;
    private int outputRows;
    private int keyCount;
    private String frequency;
    private String forecastAlias;

    private ShapeClassification classification;
    private MappingSpec mapping;
    private FrequencyLabel frequencyDetail;
    private Diagnostics diagnostics;
    private List<CanonicalRow> rows;

    public ConversionResponse() {}

    public static ConversionResponse from(ConversionResult result) {
        ConversionResponse response = new ConversionResponse();
        response.setSuccess(true);
        response.setInputRows(result.getInputRows());
        response.setOutputRows(result.getSeries().size());
        response.setKeyCount(result.getSeries().keys().size());
        response.setFrequency(result.getFrequency().getFrequency().name());
        response.setForecastAlias(result.getFrequency().getForecastAlias());
        response.setClassification(result.getClassification());
        response.setMapping(result.getMapping());
        response.setFrequencyDetail(result.getFrequency());
        response.setDiagnostics(result.getDiagnostics());
        response.setRows(result.getSeries().getRows());
        response.setMessage(String.format("Converted %d rows into %d observations",
                result.getInputRows(), result.getSeries().size()));
        return response;
    }
}
