package com.bmsedge.seriesprep.exception;

public class PipelineCancelledException extends BusinessException {

    public PipelineCancelledException(String message) {
        super(message);
    }

    public PipelineCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
