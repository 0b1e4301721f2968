package com.trading.amm.api;

import com.trading.amm.core.PoolId;
import com.trading.amm.core.PoolKey;

import java.math.BigInteger;

/**
 * Observability hooks fired by the pool manager.
 *
 * Events are buffered during a top-level call and delivered, in order, only
 * after that call commits. A call that rolls back produces no events. Callbacks
 * run on the engine's calling thread; keep them cheap and never call back into
 * the engine from one.
 */
public interface EngineListener {

    EngineListener NO_OP = new EngineListener() {
    };

    default void onPoolCreated(PoolId poolId, PoolKey key) {
    }

    default void onLiquidityAdded(PoolId poolId, Address provider, BigInteger amount0, BigInteger amount1,
            BigInteger shares) {
    }

    default void onLiquidityRemoved(PoolId poolId, Address provider, BigInteger amount0, BigInteger amount1,
            BigInteger shares) {
    }

    default void onSwap(PoolId poolId, Address beneficiary, boolean zeroForOne, BigInteger amountIn,
            BigInteger amountOut) {
    }

    default void onSessionSettled(Address owner, int tokensSettled) {
    }

    default void onProtocolFee(PoolId poolId, Address treasury, BigInteger fee0, BigInteger fee1) {
    }
}
