package com.trading.amm.strategy;

import com.trading.amm.api.PricingStrategy;
import com.trading.amm.api.QuoteParams;
import com.trading.amm.api.RoutedPayload;
import com.trading.amm.core.UintMath;
import com.trading.amm.quote.PriceData;

import java.math.BigInteger;

/**
 * Prices at an external oracle rate minus a spread.
 *
 * The rate comes from the first non-empty bridge payload, decoded as
 * {@link PriceData} (asset1 per asset0, scaled by 1e18). The spread is the base
 * spread plus one basis point per bucket id, so higher buckets quote wider.
 * Returns zero when no usable price arrived or the output would drain the pool.
 */
public class OraclePriceStrategy implements PricingStrategy {
    private final int spreadBps;

    public OraclePriceStrategy(int spreadBps) {
        if (spreadBps < 0 || spreadBps >= UintMath.BPS.intValue())
            throw new IllegalArgumentException("Spread must be in [0, 10000) bps");
        this.spreadBps = spreadBps;
    }

    @Override
    public BigInteger quote(QuoteParams params, RoutedPayload payload) {
        byte[] data = payload.firstAvailable();
        if (!PriceData.isEncoded(data))
            return BigInteger.ZERO;
        BigInteger price = PriceData.decode(data).priceWad();
        if (price.signum() == 0)
            return BigInteger.ZERO;

        BigInteger gross = params.zeroForOne()
                ? UintMath.mulDiv(params.amountIn(), price, UintMath.WAD)
                : UintMath.mulDiv(params.amountIn(), UintMath.WAD, price);

        long spread = (long) spreadBps + params.bucketId();
        if (spread >= UintMath.BPS.longValue())
            return BigInteger.ZERO;
        BigInteger out = UintMath.mulDiv(gross, UintMath.BPS.subtract(BigInteger.valueOf(spread)), UintMath.BPS);
        return out.compareTo(params.reserveOut()) >= 0 ? BigInteger.ZERO : out;
    }
}
