package com.tradejournal.api.dto.response;

import com.tradejournal.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Error envelope: {@code {"success": false, "error": {...}}}. */
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
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details != null && !details.isEmpty() ? details : null)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;

        /** Offending fields, or the accountId / symbol / orderId a rebuild error is about. */
        private final Map<String, Object> details;

        private final String path;
        private final Instant timestamp;
    }
}
