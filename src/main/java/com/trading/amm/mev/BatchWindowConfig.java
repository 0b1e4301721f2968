package com.trading.amm.mev;

import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;

/**
 * Recurring execution window: in every cycle of {@code cycleLength} blocks, the
 * first {@code settlementBlocks} blocks accept trades.
 */
public record BatchWindowConfig(long cycleLength, long settlementBlocks, boolean enabled) {

    public BatchWindowConfig {
        if (cycleLength <= 0)
            throw new ConfigurationException(ErrorCode.INVALID_BATCH_CONFIG, "cycleLength must be positive");
        if (settlementBlocks < 0 || settlementBlocks > cycleLength)
            throw new ConfigurationException(ErrorCode.INVALID_BATCH_CONFIG,
                    "settlementBlocks " + settlementBlocks + " outside [0, " + cycleLength + "]");
    }

    public static BatchWindowConfig of(long cycleLength, long settlementBlocks) {
        return new BatchWindowConfig(cycleLength, settlementBlocks, true);
    }

    /** True when {@code block} falls in the settlement part of its cycle. */
    public boolean isActive(long block) {
        return enabled && Math.floorMod(block, cycleLength) < settlementBlocks;
    }

    /** Blocks until the next window opens; 0 when already open. */
    public long blocksUntilActive(long block) {
        long pos = Math.floorMod(block, cycleLength);
        return pos < settlementBlocks ? 0 : cycleLength - pos;
    }
}
