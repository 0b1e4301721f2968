package com.trading.amm.util;

import com.trading.amm.api.Address;
import com.trading.amm.api.EngineListener;
import com.trading.amm.core.PoolId;
import com.trading.amm.core.PoolKey;

import java.math.BigInteger;
import java.util.Arrays;

/** Fans engine events out to several {@link EngineListener} instances. */
public class CompositeEngineListener implements EngineListener {
    private EngineListener[] listeners = new EngineListener[0];

    public CompositeEngineListener add(EngineListener listener) {
        EngineListener[] old = listeners;
        EngineListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onPoolCreated(PoolId poolId, PoolKey key) {
        for (EngineListener l : listeners)
            l.onPoolCreated(poolId, key);
    }

    @Override
    public void onLiquidityAdded(PoolId poolId, Address provider, BigInteger amount0, BigInteger amount1,
            BigInteger shares) {
        for (EngineListener l : listeners)
            l.onLiquidityAdded(poolId, provider, amount0, amount1, shares);
    }

    @Override
    public void onLiquidityRemoved(PoolId poolId, Address provider, BigInteger amount0, BigInteger amount1,
            BigInteger shares) {
        for (EngineListener l : listeners)
            l.onLiquidityRemoved(poolId, provider, amount0, amount1, shares);
    }

    @Override
    public void onSwap(PoolId poolId, Address beneficiary, boolean zeroForOne, BigInteger amountIn,
            BigInteger amountOut) {
        for (EngineListener l : listeners)
            l.onSwap(poolId, beneficiary, zeroForOne, amountIn, amountOut);
    }

    @Override
    public void onSessionSettled(Address owner, int tokensSettled) {
        for (EngineListener l : listeners)
            l.onSessionSettled(owner, tokensSettled);
    }

    @Override
    public void onProtocolFee(PoolId poolId, Address treasury, BigInteger fee0, BigInteger fee1) {
        for (EngineListener l : listeners)
            l.onProtocolFee(poolId, treasury, fee0, fee1);
    }
}
