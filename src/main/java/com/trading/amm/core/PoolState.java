package com.trading.amm.core;

import java.math.BigInteger;

/**
 * Snapshot of one pool's accounting.
 *
 * Invariant: {@code totalShares == 0} iff both reserves are zero. The permanent
 * lock minted on the first deposit is never owned by anyone, so once a pool is
 * funded its share supply can not return to zero.
 *
 * @param reserve0            inventory of asset0 (u128)
 * @param reserve1            inventory of asset1 (u128)
 * @param totalShares         outstanding liquidity shares including the lock
 * @param feeBaseline0        reserve0 right after the last liquidity event
 * @param feeBaseline1        reserve1 right after the last liquidity event
 */
public record PoolState(BigInteger reserve0, BigInteger reserve1, BigInteger totalShares,
        BigInteger feeBaseline0, BigInteger feeBaseline1) {

    public static final PoolState EMPTY = new PoolState(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO,
            BigInteger.ZERO, BigInteger.ZERO);

    public boolean isEmpty() {
        return totalShares.signum() == 0;
    }

    public BigInteger reserve(boolean zero) {
        return zero ? reserve0 : reserve1;
    }
}
