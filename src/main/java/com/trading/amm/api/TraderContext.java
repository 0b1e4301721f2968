package com.trading.amm.api;

/**
 * Execution context appended to the routed payload when a pool's marking sets
 * the enhanced-context flag.
 *
 * @param timestamp     block timestamp in seconds
 * @param blockNumber   block height
 * @param gasPrice      gas price of the executing call
 * @param sessionActive whether the beneficiary is inside a flash session
 */
public record TraderContext(long timestamp, long blockNumber, long gasPrice, boolean sessionActive) {
}
