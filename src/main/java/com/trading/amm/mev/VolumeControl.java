package com.trading.amm.mev;

import com.trading.amm.api.Address;
import com.trading.amm.core.PoolId;
import com.trading.amm.core.StateJournal;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.MevProtectionException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Volume-control gate.
 *
 * Keeps a cumulative input-volume counter per (trader, pool) for trades that ran
 * under a volume mode, and asks the {@link ProtectionPolicy} whether the next
 * trade fits. Counters are journaled.
 */
public final class VolumeControl {
    private final ProtectionPolicy policy;
    private final StateJournal journal;
    private final Map<Counter, BigInteger> volumes = new HashMap<>();

    public VolumeControl(ProtectionPolicy policy, StateJournal journal) {
        this.policy = policy;
        this.journal = journal;
    }

    public void checkAndRecord(Address trader, PoolId pool, Set<PoolFeature> features, TraderProtection protection,
            BigInteger amountIn) {
        int mode = protection.volumeMode();
        if (mode == 0 || !features.contains(PoolFeature.VOLUME_CONTROL))
            return;
        Counter key = new Counter(trader, pool);
        BigInteger soFar = volumes.getOrDefault(key, BigInteger.ZERO);
        if (!policy.isWithinVolumeLimit(trader, pool, mode, soFar, amountIn))
            throw new MevProtectionException(ErrorCode.VOLUME_LIMIT_EXCEEDED,
                    trader + " exceeds volume limit on " + pool + " (mode " + mode + ")");
        journal.put(volumes, key, soFar.add(amountIn));
    }

    public BigInteger volumeOf(Address trader, PoolId pool) {
        return volumes.getOrDefault(new Counter(trader, pool), BigInteger.ZERO);
    }

    private record Counter(Address trader, PoolId pool) {
    }
}
