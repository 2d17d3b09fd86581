package com.portfoliotrader.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the application's unchecked exceptions. The engine converts these into refusals
 * (a {@code false} or empty result plus a log line); the REST layer maps {@link #getErrorCode()}
 * to an HTTP status.
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
}
