package com.optionengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION", 500, false),
    INVALID_STATE("INVALID_STATE", 409, false),
    PRICE_UNAVAILABLE("PRICE_UNAVAILABLE", 503, true),
    STALE_CANCEL("STALE_CANCEL", 409, false),
    PERSISTENCE_FAILURE("PERSISTENCE_FAILURE", 500, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    BROKER_ERROR("BROKER_ERROR", 502, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
