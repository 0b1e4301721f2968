package com.trading.amm.error;

/** Malformed assets, unknown pools or strategies, degenerate amounts and invalid settings. */
public class ConfigurationException extends AmmException {

    public ConfigurationException(ErrorCode code, String message) {
        super(code, message);
    }

    public ConfigurationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
