package com.trading.amm.engine;

import com.trading.amm.core.PoolId;

import java.math.BigInteger;

/** Amounts moved by a liquidity event, in canonical asset order, and the shares minted or burned. */
public record LiquidityResult(PoolId poolId, BigInteger amount0, BigInteger amount1, BigInteger shares) {
}
