package com.trading.amm.mev;

import com.trading.amm.api.Address;
import com.trading.amm.core.PoolId;

import java.math.BigInteger;

/**
 * Extension point deciding what access-control, circuit-breaker and
 * volume-control modes actually enforce.
 *
 * The engine only decodes modes and consults this policy; it defines no policy
 * of its own. {@link #ALLOW_ALL} permits everything.
 */
public interface ProtectionPolicy {

    ProtectionPolicy ALLOW_ALL = new ProtectionPolicy() {
    };

    /** Access control: may {@code trader} trade on {@code pool} under {@code mode}. */
    default boolean isAllowed(Address trader, PoolId pool, int mode) {
        return true;
    }

    /** Circuit breaker: is trading on {@code pool} currently permitted under {@code mode}. */
    default boolean isCircuitClosed(PoolId pool, int mode) {
        return true;
    }

    /**
     * Volume control: may a trade of {@code amountIn} proceed, given the trader's
     * cumulative input volume on the pool so far.
     */
    default boolean isWithinVolumeLimit(Address trader, PoolId pool, int mode, BigInteger volumeSoFar,
            BigInteger amountIn) {
        return true;
    }
}
