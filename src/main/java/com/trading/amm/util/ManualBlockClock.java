package com.trading.amm.util;

import com.trading.amm.api.BlockContext;

/** A {@link BlockContext} driven by hand, for simulations and tests. */
public final class ManualBlockClock implements BlockContext {
    public static final long SECONDS_PER_BLOCK = 12;

    private long blockNumber;
    private long timestamp;
    private long gasPrice;

    public ManualBlockClock(long blockNumber, long timestamp) {
        this.blockNumber = blockNumber;
        this.timestamp = timestamp;
    }

    public ManualBlockClock() {
        this(1, 1_700_000_000L);
    }

    @Override
    public long blockNumber() {
        return blockNumber;
    }

    @Override
    public long timestamp() {
        return timestamp;
    }

    @Override
    public long gasPrice() {
        return gasPrice;
    }

    public ManualBlockClock setBlockNumber(long blockNumber) {
        this.blockNumber = blockNumber;
        return this;
    }

    public ManualBlockClock setGasPrice(long gasPrice) {
        this.gasPrice = gasPrice;
        return this;
    }

    /** Moves forward {@code blocks} blocks, advancing the timestamp with them. */
    public ManualBlockClock advance(long blocks) {
        if (blocks < 0)
            throw new IllegalArgumentException("Cannot move back in time");
        blockNumber += blocks;
        timestamp += blocks * SECONDS_PER_BLOCK;
        return this;
    }
}
