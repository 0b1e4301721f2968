package com.trading.amm.error;

/**
 * Stable failure codes carried by every {@link AmmException}.
 *
 * Codes are grouped by the exception family that raises them. None of them is
 * retryable: a failed top-level call has already been rolled back in full when
 * the exception reaches the caller.
 */
public enum ErrorCode {
    // Configuration
    INVALID_ASSETS,
    IDENTICAL_ASSETS,
    POOL_ALREADY_EXISTS,
    POOL_NOT_FOUND,
    UNKNOWN_STRATEGY,
    INSUFFICIENT_INITIAL_LIQUIDITY,
    INVALID_AMOUNT,
    INVALID_BATCH_CONFIG,
    INVALID_BRIDGE_SLOT,
    INVALID_HOP,

    // Pricing
    QUOTE_UNAVAILABLE,
    SLIPPAGE_VIOLATION,

    // Liquidity
    NO_LIQUIDITY,
    INSUFFICIENT_WITHDRAWAL,
    INSUFFICIENT_SHARES,
    INSUFFICIENT_RESERVES,
    RESERVE_OVERFLOW,

    // Sessions
    SESSION_ALREADY_ACTIVE,
    SESSION_NOT_ACTIVE,
    UNSETTLED_DELTAS,
    REENTRANT_CALL,
    INSUFFICIENT_FUNDS,

    // MEV protection
    INVALID_COMMITMENT,
    COMMITMENT_TOO_NEW,
    COMMITMENT_EXPIRED,
    INVALID_NONCE,
    ATOMIC_EXECUTION_REQUIRED,
    OUTSIDE_BATCH_WINDOW,
    ACCESS_DENIED,
    CIRCUIT_OPEN,
    VOLUME_LIMIT_EXCEEDED
}
