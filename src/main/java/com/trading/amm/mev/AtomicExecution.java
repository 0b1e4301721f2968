package com.trading.amm.mev;

import com.trading.amm.error.ConfigurationException;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.MevProtectionException;

import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Atomic-execution gate.
 *
 * A trader who sets the atomic bit must trade inside an active flash session.
 * A non-zero batch mode additionally restricts the trade to the open part of the
 * selected {@link BatchWindowConfig}; a disabled config leaves only the session
 * requirement. While the emergency mode is non-zero it replaces every trader's
 * choice: all protected swaps are atomic and gated by that config.
 */
@Log4j2
public final class AtomicExecution {
    public static final int CONFIG_COUNT = 7;

    /** Default windows as (cycleLength, settlementBlocks), modes 1..7. */
    public static final List<BatchWindowConfig> DEFAULT_CONFIGS = List.of(
            BatchWindowConfig.of(2, 1),
            BatchWindowConfig.of(5, 2),
            BatchWindowConfig.of(10, 3),
            BatchWindowConfig.of(20, 5),
            BatchWindowConfig.of(50, 10),
            BatchWindowConfig.of(100, 20),
            BatchWindowConfig.of(3, 1));

    private final BatchWindowConfig[] configs = new BatchWindowConfig[CONFIG_COUNT + 1];
    private int emergencyMode;

    public AtomicExecution() {
        this(DEFAULT_CONFIGS);
    }

    public AtomicExecution(List<BatchWindowConfig> windows) {
        if (windows.size() != CONFIG_COUNT)
            throw new ConfigurationException(ErrorCode.INVALID_BATCH_CONFIG,
                    "Expected " + CONFIG_COUNT + " batch windows, got " + windows.size());
        for (int i = 0; i < CONFIG_COUNT; i++)
            configs[i + 1] = windows.get(i);
    }

    public BatchWindowConfig config(int mode) {
        checkMode(mode);
        return configs[mode];
    }

    public void setConfig(int mode, BatchWindowConfig config) {
        checkMode(mode);
        configs[mode] = config;
    }

    public int emergencyMode() {
        return emergencyMode;
    }

    /** 0 switches emergency mode off; 1..7 forces that config for every protected swap. */
    public void setEmergencyMode(int mode) {
        if (mode != 0)
            checkMode(mode);
        if (mode != emergencyMode)
            log.info("Emergency batch mode {} -> {}", emergencyMode, mode);
        emergencyMode = mode;
    }

    /**
     * @throws MevProtectionException {@code ATOMIC_EXECUTION_REQUIRED} without a
     *                                session, {@code OUTSIDE_BATCH_WINDOW} when
     *                                the selected window is closed
     */
    public void check(TraderProtection protection, boolean sessionActive, long blockNumber) {
        boolean atomic = protection.atomic();
        int mode = protection.batchMode();
        if (emergencyMode != 0) {
            atomic = true;
            mode = emergencyMode;
        }
        if (!atomic)
            return;
        if (!sessionActive)
            throw new MevProtectionException(ErrorCode.ATOMIC_EXECUTION_REQUIRED,
                    "Atomic execution requires an active flash session");
        if (mode == 0)
            return;
        BatchWindowConfig cfg = configs[mode];
        if (cfg.enabled() && !cfg.isActive(blockNumber))
            throw new MevProtectionException(ErrorCode.OUTSIDE_BATCH_WINDOW,
                    "Block " + blockNumber + " outside batch window " + mode + " (" + cfg.settlementBlocks() + "/"
                            + cfg.cycleLength() + "), opens in " + cfg.blocksUntilActive(blockNumber));
    }

    private static void checkMode(int mode) {
        if (mode < 1 || mode > CONFIG_COUNT)
            throw new ConfigurationException(ErrorCode.INVALID_BATCH_CONFIG, "Batch mode must be 1.." + CONFIG_COUNT);
    }
}
