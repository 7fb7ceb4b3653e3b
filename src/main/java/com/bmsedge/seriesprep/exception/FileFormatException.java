package com.bmsedge.seriesprep.exception;

public class FileFormatException extends BusinessException {

    public FileFormatException(String message) {
        super(message);
    }

    public FileFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
