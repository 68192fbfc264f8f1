package com.tradejournal.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes returned in {@code error.code}. {@code retryable} tells the client whether sending
 * the same request again can succeed; a failed import writes nothing, so storage errors are.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    BROKER_NOT_FOUND("BROKER_NOT_FOUND", 404, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    STORAGE_ERROR("STORAGE_ERROR", 503, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
