package com.trading.amm.error;

/** Flash-session misuse: nested starts, unsettled deltas, reentrant calls, unfunded settlement. */
public class SessionException extends AmmException {

    public SessionException(ErrorCode code, String message) {
        super(code, message);
    }

    public SessionException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
