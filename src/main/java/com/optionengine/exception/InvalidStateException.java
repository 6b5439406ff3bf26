package com.optionengine.exception;

import java.util.Map;

/**
 * A position cannot be tracked in its current state, e.g. it has no usable entry price.
 * Fatal for that position only.
 */
public class InvalidStateException extends BaseException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public InvalidStateException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_STATE, message, details);
    }
}
