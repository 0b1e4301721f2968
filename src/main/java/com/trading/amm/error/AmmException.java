package com.trading.amm.error;

/**
 * Root of the engine's failure taxonomy.
 *
 * All engine failures are synchronous and abort the whole top-level operation.
 * Subclasses only narrow the family; the precise reason is always available
 * through {@link #code()}.
 */
public class AmmException extends RuntimeException {
    private final ErrorCode code;

    public AmmException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AmmException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
