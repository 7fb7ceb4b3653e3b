package com.bmsedge.seriesprep.dto;

import com.bmsedge.seriesprep.model.MappingOverride;
import com.bmsedge.seriesprep.model.ShapeType;
import com.bmsedge.seriesprep.util.ShapeTypeDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Partial column mapping sent along with an upload. Every field is optional.
 */
@Setter
@Getter
public class MappingOverrideRequest {

    @JsonDeserialize(using = ShapeTypeDeserializer.class)
    private ShapeType shape;

    @Size(max = 20, message = "At most 20 key columns may be declared")
    private List<String> keyColumns;

    @Size(max = 10, message = "Key separator must not exceed 10 characters")
    private String keySeparator;

    @Size(max = 255, message = "Date column name must not exceed 255 characters")
    private String dateColumn;

    @Size(max = 255, message = "Value column name must not exceed 255 characters")
    private String valueColumn;

    private List<String> dateHeaderColumns;

    public MappingOverrideRequest() {}

    public MappingOverride toOverride() {
        return new MappingOverride(shape, keyColumns, keySeparator, dateColumn, valueColumn, dateHeaderColumns);
    }
}
