package com.optionengine.exception;

/**
 * Raised for configuration that cannot be acted on, such as an unknown sizing mode.
 * Thrown during startup validation it aborts the application context.
 */
public class InvalidConfigurationException extends BaseException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }
}
