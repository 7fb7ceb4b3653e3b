package com.bmsedge.seriesprep.dto;

import com.bmsedge.seriesprep.model.ColumnProfile;
import com.bmsedge.seriesprep.model.FrequencyLabel;
import com.bmsedge.seriesprep.model.MappingSpec;
import com.bmsedge.seriesprep.model.ProfileResult;
import com.bmsedge.seriesprep.model.ShapeClassification;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Setter
@Getter
public class ProfileResponse {

    private boolean success;
    private String shape;
    private double confidence;
    private boolean mappingResolved;

    private ShapeClassification classification;
    private List<ColumnProfile> columns;
    private List<String> dateCandidates;
    private FrequencyLabel frequency;
    private MappingSpec mapping;
    private List<String> missingRoles;
    private List<String> notes;

    public ProfileResponse() {}

    public static ProfileResponse from(ProfileResult result) {
        ProfileResponse response = new ProfileResponse();
        response.setSuccess(true);
        response.setShape(result.getClassification().getShape().name());
        response.setConfidence(result.getClassification().getConfidence());
        response.setMappingResolved(result.isMappingResolved());
        response.setClassification(result.getClassification());
        response.setColumns(result.getColumns());
        response.setDateCandidates(result.getDateCandidates());
        response.setFrequency(result.getFrequency());
        response.setMapping(result.getMapping());
        response.setMissingRoles(result.getMissingRoles());
        response.setNotes(result.getNotes());
        return response;
    }
}
