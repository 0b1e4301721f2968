package com.trading.amm.mev;

import com.trading.amm.api.Address;
import com.trading.amm.core.PoolId;
import com.trading.amm.error.ErrorCode;
import com.trading.amm.error.MevProtectionException;

import java.util.Set;

/** Access-control gate. Enforcement is delegated to the {@link ProtectionPolicy}. */
public final class AccessControl {
    private final ProtectionPolicy policy;

    public AccessControl(ProtectionPolicy policy) {
        this.policy = policy;
    }

    public void check(Address trader, PoolId pool, Set<PoolFeature> features, TraderProtection protection) {
        int mode = protection.accessMode();
        if (mode == 0 || !features.contains(PoolFeature.ACCESS_CONTROL))
            return;
        if (!policy.isAllowed(trader, pool, mode))
            throw new MevProtectionException(ErrorCode.ACCESS_DENIED,
                    trader + " denied on " + pool + " (mode " + mode + ")");
    }
}
