package com.tradejournal.api.dto.response;

import java.time.Instant;
import java.util.Map;
import lombok.Getter;

/**
 * Success envelope: {@code {"success": true, "data": ..., "meta": {...}}}.
 * {@code meta} carries listing context such as counts and applied filters; null when unused.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Map<String, Object> meta;
    private final Instant timestamp;

    private ApiResponse(T data, Map<String, Object> meta) {
        this.data = data;
        this.meta = meta;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, null);
    }

    public static <T> ApiResponse<T> of(T data, Map<String, Object> meta) {
        return new ApiResponse<>(data, meta);
    }
}
