package com.tradejournal.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the service's exceptions. The {@link ErrorCode} fixes the HTTP status; {@code details}
 * names what the error is about (user, account, symbol, order) and is returned to the caller
 * as-is.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    /** A detail rendered as text, or null when absent. */
    public String detail(String key) {
        Object value = details.get(key);
        return value != null ? value.toString() : null;
    }
}
