package com.portfoliotrader.api.dto.response;

import com.portfoliotrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * Error envelope: {@code {"success": false, "error": {code, status, message, details, path, timestamp}}}.
 * {@code details} carries the offending fields or the strategy/instrument the refusal concerns.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorBody error;

    private ApiErrorResponse(ErrorBody error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorBody.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null ? Map.of() : details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Value
    @Builder
    public static class ErrorBody {
        String code;
        int status;
        String message;
        Map<String, Object> details;
        String path;
        Instant timestamp;
    }
}
