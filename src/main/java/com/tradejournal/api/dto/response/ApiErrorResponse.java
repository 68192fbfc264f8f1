package com.tradejournal.api.dto.response;

import com.tradejournal.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body written by {@link com.tradejournal.exception.GlobalExceptionHandler}.
 *
 * <p>{@code error.retryable} is true when the same upload can simply be sent again, e.g. after
 * the trade store failed and nothing was written.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .retryable(errorCode.isRetryable())
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final boolean retryable;

        /** Field errors or lookup context; null when there is nothing to add. */
        private final Map<String, Object> details;

        private final String path;
        private final Instant timestamp;
    }
}
