package com.trading.amm.strategy;

import com.trading.amm.api.PricingStrategy;
import com.trading.amm.api.QuoteParams;
import com.trading.amm.api.RoutedPayload;
import com.trading.amm.core.UintMath;

import java.math.BigInteger;

/**
 * Constant-product pricing (x * y = k) with an input fee.
 *
 * Formula:
 * out = in * (10000 - fee) * rOut / (rIn * 10000 + in * (10000 - fee))
 *
 * Ignores bridge data entirely.
 */
public class ConstantProductStrategy implements PricingStrategy {
    public static final int DEFAULT_FEE_BPS = 30;

    private final BigInteger feeComplement;

    public ConstantProductStrategy() {
        this(DEFAULT_FEE_BPS);
    }

    public ConstantProductStrategy(int feeBps) {
        if (feeBps < 0 || feeBps >= UintMath.BPS.intValue())
            throw new IllegalArgumentException("Fee must be in [0, 10000) bps");
        this.feeComplement = UintMath.BPS.subtract(BigInteger.valueOf(feeBps));
    }

    @Override
    public BigInteger quote(QuoteParams params, RoutedPayload payload) {
        BigInteger rIn = params.reserveIn();
        BigInteger rOut = params.reserveOut();
        BigInteger in = params.amountIn();
        if (rIn.signum() <= 0 || rOut.signum() <= 0 || in.signum() <= 0)
            return BigInteger.ZERO;
        BigInteger inWithFee = in.multiply(feeComplement);
        return UintMath.mulDiv(inWithFee, rOut, rIn.multiply(UintMath.BPS).add(inWithFee));
    }
}
