package com.trading.amm.strategy;

import com.trading.amm.api.PricingStrategy;
import com.trading.amm.api.QuoteParams;
import com.trading.amm.api.RoutedPayload;
import com.trading.amm.quote.PriceData;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Avellaneda-Stoikov style market making around an oracle mid.
 *
 * <h3>Model</h3>
 * The bucket id selects a minimum half-spread {@code dmin} (bps) from a fixed
 * table. From it:
 * <ul>
 * <li>{@code k = round(10000 / dmin)}, {@code s = (dmin / 10000)^2}</li>
 * <li>half-spread {@code d = ln(1 + gamma / k) / gamma + gamma * s / 2}
 * ({@code 1 / k} when gamma is 0)</li>
 * <li>inventory {@code q} in [-1, 1]: positive when the pool holds more asset0
 * value than asset1 value</li>
 * <li>reservation {@code r = mid * (1 - q * qScale * gamma * s)}</li>
 * </ul>
 * The pool buys asset0 at {@code r * (1 - d)} and sells it at
 * {@code r * (1 + d)}. A long pool therefore quotes lower and attracts buyers.
 *
 * Computations are done in doubles; amounts are converted at the edges.
 */
public class InventorySkewStrategy implements PricingStrategy {
    static final double[] DELTA_MIN_BPS = { 0.5, 1, 2, 5, 10, 20, 30, 50, 100, 200, 500 };

    private final double gamma;
    private final double qScale;

    public InventorySkewStrategy() {
        this(0.3, 500);
    }

    public InventorySkewStrategy(double gamma, double qScale) {
        if (gamma < 0 || Double.isNaN(gamma))
            throw new IllegalArgumentException("gamma must be >= 0");
        if (qScale < 0 || Double.isNaN(qScale))
            throw new IllegalArgumentException("qScale must be >= 0");
        this.gamma = gamma;
        this.qScale = qScale;
    }

    @Override
    public BigInteger quote(QuoteParams params, RoutedPayload payload) {
        byte[] data = payload.firstAvailable();
        if (!PriceData.isEncoded(data))
            return BigInteger.ZERO;
        double mid = PriceData.decode(data).price();
        if (!(mid > 0))
            return BigInteger.ZERO;

        double dmin = DELTA_MIN_BPS[params.bucketId() % DELTA_MIN_BPS.length];
        double half = halfSpread(dmin);
        double s = sigma2tau(dmin);
        double q = imbalance(params.reserve0().doubleValue(), params.reserve1().doubleValue(), mid);
        double reservation = mid * (1 - q * qScale * gamma * s);

        double factor = params.zeroForOne()
                ? reservation * (1 - half)
                : 1 / (reservation * (1 + half));
        if (!(factor > 0) || Double.isInfinite(factor))
            return BigInteger.ZERO;

        BigInteger out = new BigDecimal(params.amountIn()).multiply(BigDecimal.valueOf(factor)).toBigInteger();
        return out.compareTo(params.reserveOut()) >= 0 ? BigInteger.ZERO : out;
    }

    /** Half-spread as a fraction for the given minimum half-spread in bps. */
    double halfSpread(double dminBps) {
        double k = Math.round(10_000 / dminBps);
        if (gamma == 0)
            return 1 / k;
        return Math.log(1 + gamma / k) / gamma + gamma * sigma2tau(dminBps) / 2;
    }

    static double sigma2tau(double dminBps) {
        double rel = dminBps / 10_000;
        return rel * rel;
    }

    /** (v0 - v1) / (v0 + v1) with v0 = r0 * mid, v1 = r1; 0 for an empty pool. */
    static double imbalance(double r0, double r1, double mid) {
        double v0 = r0 * mid;
        double total = v0 + r1;
        if (!(total > 0))
            return 0;
        return Math.max(-1, Math.min(1, (v0 - r1) / total));
    }
}
