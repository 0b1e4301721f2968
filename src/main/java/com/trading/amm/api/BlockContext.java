package com.trading.amm.api;

/**
 * Read-only view of the host execution environment.
 *
 * Commit-reveal windows, batch windows and the enhanced trader context all read
 * the current block through this interface, so tests can drive time explicitly.
 */
public interface BlockContext {

    /** Current block height. */
    long blockNumber();

    /** Current block timestamp in seconds. */
    long timestamp();

    /** Gas price of the executing transaction, in the host's smallest unit. */
    long gasPrice();
}
