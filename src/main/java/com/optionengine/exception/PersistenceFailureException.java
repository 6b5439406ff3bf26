package com.optionengine.exception;

/**
 * Writing to the position store failed. In-memory state stays authoritative for the session.
 */
public class PersistenceFailureException extends BaseException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, message, cause);
    }
}
