package com.trading.amm.error;

/** A commit-reveal or execution-window rule was violated. */
public class MevProtectionException extends AmmException {

    public MevProtectionException(ErrorCode code, String message) {
        super(code, message);
    }

    public MevProtectionException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
