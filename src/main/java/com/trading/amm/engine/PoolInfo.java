package com.trading.amm.engine;

import com.trading.amm.api.Address;
import com.trading.amm.core.PoolKey;

/** Externally visible pool coordinates. {@link #EMPTY} stands in for unknown pools. */
public record PoolInfo(Address asset0, Address asset1, Address strategy, int marking) {
    public static final PoolInfo EMPTY = new PoolInfo(Address.ZERO, Address.ZERO, Address.ZERO, 0);

    public static PoolInfo of(PoolKey key) {
        return new PoolInfo(key.asset0(), key.asset1(), key.strategy(), key.marking());
    }

    public boolean exists() {
        return !asset0.isZero();
    }
}
