package com.optionengine.exception;

/**
 * A cancel lost the race against a fill or an earlier cancel. Expected in normal operation.
 */
public class StaleCancelRaceException extends BaseException {

    public StaleCancelRaceException(String orderId) {
        super(ErrorCode.STALE_CANCEL, "Order " + orderId + " is no longer pending");
    }
}
