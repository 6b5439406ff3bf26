package com.optionengine.exception;

import java.util.Map;

/** No usable last traded price arrived in time. The current signal is dropped. */
public class PriceUnavailableException extends BaseException {

    public PriceUnavailableException(String symbol, int attempts) {
        super(
                ErrorCode.PRICE_UNAVAILABLE,
                "No LTP for " + symbol + " after " + attempts + " attempts",
                Map.of("symbol", symbol, "attempts", attempts));
    }
}
