package com.trading.amm.mev;

import com.trading.amm.core.PoolId;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.MevProtectionException;

import java.util.Set;

/** Circuit-breaker gate. Whether a circuit is open is the {@link ProtectionPolicy}'s call. */
public final class CircuitBreaker {
    private final ProtectionPolicy policy;

    public CircuitBreaker(ProtectionPolicy policy) {
        this.policy = policy;
    }

    public void check(PoolId pool, Set<PoolFeature> features, TraderProtection protection) {
        int mode = protection.circuitMode();
        if (mode == 0 || !features.contains(PoolFeature.CIRCUIT_BREAKER))
            return;
        if (!policy.isCircuitClosed(pool, mode))
            throw new MevProtectionException(ErrorCode.CIRCUIT_OPEN, "Circuit open on " + pool + " (mode " + mode + ")");
    }
}
