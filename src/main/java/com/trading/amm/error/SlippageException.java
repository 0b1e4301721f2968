package com.trading.amm.error;

/** The realised output fell below the caller's minimum. */
public class SlippageException extends AmmException {

    public SlippageException(ErrorCode code, String message) {
        super(code, message);
    }

    public SlippageException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
