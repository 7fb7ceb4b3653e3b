package com.bmsedge.seriesprep.model;

import lombok.Getter;

/**
 * Outcome of parsing one cell or header: either a value or the reason it was rejected.
 */
@Getter
public final class ParseResult<T> {

    private final T value;
    private final DiagnosticReason failureReason;
    private final String detail;

    private ParseResult(T value, DiagnosticReason failureReason, String detail) {
        this.value = value;
        this.failureReason = failureReason;
        this.detail = detail;
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(value, null, null);
    }

    public static <T> ParseResult<T> failure(DiagnosticReason reason, String detail) {
        return new ParseResult<>(null, reason, detail);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public boolean isFailure() {
        return failureReason != null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[" + value + "]" : "ParseResult[" + failureReason + ": " + detail + "]";
    }
}
