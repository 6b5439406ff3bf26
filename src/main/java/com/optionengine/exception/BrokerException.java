package com.optionengine.exception;

/**
 * Broker refused an order or could not be reached. The order is treated as REJECTED
 * and no position is opened for it.
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }
}
