package com.trading.amm.error;

/** The pricing strategy produced no usable price (a zero quote). */
public class QuoteUnavailableException extends AmmException {

    public QuoteUnavailableException(ErrorCode code, String message) {
        super(code, message);
    }

    public QuoteUnavailableException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
