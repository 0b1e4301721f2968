package com.trading.amm.quote;

import com.trading.amm.core.PoolId;

import java.math.BigInteger;

/** Output of the quote router: the priced amount and the pool it was priced for. */
public record Quote(BigInteger amountOut, PoolId poolId) {

    public boolean isAvailable() {
        return amountOut.signum() > 0;
    }
}
