package com.tradejournal.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes returned in {@code ApiErrorResponse.error.code}, each with its HTTP status.
 * RECONCILIATION_REQUIRED and ATOMICITY_FAILURE normally travel inside a rebuild result as
 * group problems; they only become HTTP errors when raised outside a group.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    REBUILD_IN_PROGRESS("REBUILD_IN_PROGRESS", 409),
    RECONCILIATION_REQUIRED("RECONCILIATION_REQUIRED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    ATOMICITY_FAILURE("ATOMICITY_FAILURE", 503);

    private final String code;
    private final int httpStatus;
}
