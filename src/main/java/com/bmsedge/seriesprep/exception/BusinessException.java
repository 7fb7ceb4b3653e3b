package com.bmsedge.seriesprep.exception;

/**
 * Base for failures a caller can act on (bad input, unresolved mapping, unsupported file).
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
