package com.optionengine.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.optionengine.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope written by the exception handler. {@code retryable} marks broker and price
 * outages, which clear on their own, apart from bad requests and state conflicts.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiErrorResponse {

    private final boolean success = false;
    private final String code;
    private final int status;
    private final boolean retryable;
    private final String message;
    private final Map<String, Object> details;
    private final String path;
    private final Instant occurredAt;

    public static ApiErrorResponse from(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .retryable(errorCode.isRetryable())
                .message(message)
                .details(details)
                .path(path)
                .occurredAt(Instant.now())
                .build();
    }
}
