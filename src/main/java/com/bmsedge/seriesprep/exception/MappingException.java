package com.bmsedge.seriesprep.exception;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Column roles could not be resolved. Fatal for the run; the caller must declare the listed roles.
 */
@Getter
public class MappingException extends BusinessException {

    public static final String ROLE_SHAPE = "shape";
    public static final String ROLE_KEY_COLUMNS = "keyColumns";
    public static final String ROLE_DATE_COLUMN = "dateColumn";
    public static final String ROLE_VALUE_COLUMN = "valueColumn";
    public static final String ROLE_DATE_HEADERS = "dateHeaderColumns";

    private final List<String> missingRoles;
    private final List<String> invalidColumns;

    public MappingException(String message, List<String> missingRoles, List<String> invalidColumns) {
        super(message);
        this.missingRoles = Collections.unmodifiableList(new ArrayList<>(missingRoles));
        this.invalidColumns = Collections.unmodifiableList(new ArrayList<>(invalidColumns));
    }
}
