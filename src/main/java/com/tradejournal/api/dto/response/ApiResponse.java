package com.tradejournal.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Envelope for successful responses.
 *
 * <p>{@code owner} is the journal the request read from or wrote to: the {@code X-Owner-Id}
 * header, or the configured default owner when the header was absent.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final String owner;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(String owner, T data) {
        this.owner = owner;
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(String owner, T data) {
        return new ApiResponse<>(owner, data);
    }
}
