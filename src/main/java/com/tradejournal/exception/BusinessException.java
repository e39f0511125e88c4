package com.tradejournal.exception;

import java.util.Map;

/** A whole-call rejection: invalid input, or a user-level step that failed before any group ran. */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, Map.of(), cause);
    }
}
