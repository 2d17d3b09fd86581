package com.portfoliotrader.exception;

import java.util.Map;

/**
 * Refusal or failure with no dedicated exception type, such as a full engine queue or a
 * mismatch between the path and the body of a REST request.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
