package com.trading.amm.error;

/** Pool inventory cannot satisfy the request (empty pool, zero-rounding withdrawal, short reserves). */
public class LiquidityException extends AmmException {

    public LiquidityException(ErrorCode code, String message) {
        super(code, message);
    }

    public LiquidityException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
